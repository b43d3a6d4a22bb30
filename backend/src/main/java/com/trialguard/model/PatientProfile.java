package com.trialguard.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Structured patient profile as produced by the extraction collaborator.
 *
 * The extractor may leave any field empty; collection accessors never return null.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PatientProfile {

    int age;

    @Builder.Default
    Gender gender = Gender.UNKNOWN;

    List<String> conditions;
    List<String> medications;
    List<String> allergies;
    Map<String, String> biomarkers;

    String stage; // e.g. "Stage IIA"

    List<String> priorTreatments;

    String performanceStatus; // e.g. "ECOG 1"

    Map<String, String> labValues;

    public static PatientProfile empty() {
        return PatientProfile.builder().build();
    }

    public Gender getGender() {
        return gender == null ? Gender.UNKNOWN : gender;
    }

    public List<String> getConditions() {
        return conditions == null ? List.of() : conditions;
    }

    public List<String> getMedications() {
        return medications == null ? List.of() : medications;
    }

    public List<String> getAllergies() {
        return allergies == null ? List.of() : allergies;
    }

    public Map<String, String> getBiomarkers() {
        return biomarkers == null ? Map.of() : biomarkers;
    }

    public List<String> getPriorTreatments() {
        return priorTreatments == null ? List.of() : priorTreatments;
    }

    public Map<String, String> getLabValues() {
        return labValues == null ? Map.of() : labValues;
    }

    public boolean hasStage() {
        return stage != null && !stage.isBlank();
    }
}
