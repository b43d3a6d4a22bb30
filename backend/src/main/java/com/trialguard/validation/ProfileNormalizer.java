package com.trialguard.validation;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.model.PatientProfile;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fixes common extraction errors and fills in HER2/ER/PR status from free text
 * when the extractor left them blank. Missing biomarkers otherwise resolve to
 * unknown and trip "status not documented" guardrails.
 */
@Component
@Slf4j
public class ProfileNormalizer {

    private static final Pattern STAGE_WORD = Pattern.compile("stage\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGIT = Pattern.compile("(\\d)");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private static final List<String> HORMONE_RECEPTOR_POSITIVE = List.of("hr+", "hr-positive", "hormone receptor positive");

    private static final List<InferenceRule> INFERENCE_RULES = List.of(
        InferenceRule.forMarker("HER2", false),
        InferenceRule.forMarker("ER", true),
        InferenceRule.forMarker("PR", true)
    );

    public PatientProfile normalizeAndInfer(PatientProfile profile) {
        return normalizeAndInfer(profile, null);
    }

    /**
     * @param rawText original clinical note, searched alongside the structured fields; may be null
     */
    public PatientProfile normalizeAndInfer(PatientProfile profile, String rawText) {
        PatientProfile source = profile != null ? profile : PatientProfile.empty();

        List<String> conditions = nonNull(source.getConditions());
        List<String> medications = nonNull(source.getMedications());
        List<String> priorTreatments = nonNull(source.getPriorTreatments());

        Map<String, String> biomarkers = rekeyBiomarkers(source.getBiomarkers());

        List<String> corpusParts = new ArrayList<>(conditions);
        corpusParts.addAll(medications);
        corpusParts.addAll(priorTreatments);
        corpusParts.add(rawText != null ? rawText : "");
        String corpus = ClinicalPhrases.corpus(corpusParts);

        for (InferenceRule rule : INFERENCE_RULES) {
            if (!biomarkers.containsKey(rule.getMarker())) {
                rule.infer(corpus).ifPresent(value -> biomarkers.put(rule.getMarker(), value));
            }
        }

        return source.toBuilder()
            .age(Math.max(0, Math.min(120, source.getAge())))
            .gender(source.getGender())
            .conditions(conditions)
            .medications(medications)
            .allergies(nonNull(source.getAllergies()))
            .biomarkers(Collections.unmodifiableMap(biomarkers))
            .stage(normalizeStage(source.getStage()))
            .priorTreatments(priorTreatments)
            .performanceStatus(normalizePerformanceStatus(source.getPerformanceStatus()))
            .labValues(nonNull(source.getLabValues()))
            .build();
    }

    static String normalizeStage(String stage) {
        if (stage == null) {
            return null;
        }
        String token = STAGE_WORD.matcher(stage).replaceFirst("");
        token = WHITESPACE.matcher(token).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
        return token.isEmpty() ? null : "Stage " + token;
    }

    static String normalizePerformanceStatus(String performanceStatus) {
        if (performanceStatus == null || performanceStatus.isBlank()) {
            return null;
        }
        if (performanceStatus.toUpperCase(Locale.ROOT).startsWith("ECOG")) {
            return performanceStatus;
        }
        Matcher digit = DIGIT.matcher(performanceStatus);
        return digit.find() ? "ECOG " + digit.group(1) : performanceStatus;
    }

    private Map<String, String> rekeyBiomarkers(Map<String, String> biomarkers) {
        Map<String, String> rekeyed = new LinkedHashMap<>();
        biomarkers.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            String normalizedKey = NON_ALPHANUMERIC.matcher(key.toUpperCase(Locale.ROOT)).replaceAll("");
            if (!normalizedKey.isEmpty()) {
                rekeyed.put(normalizedKey, value);
            }
        });
        return rekeyed;
    }

    private static List<String> nonNull(List<String> values) {
        return values.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    private static Map<String, String> nonNull(Map<String, String> values) {
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Ordered keyword checks for one marker. The first branch that matches wins.
     */
    @Value
    private static class InferenceRule {

        String marker;
        List<String> positive;
        List<String> negative;
        boolean hormoneReceptor;

        static InferenceRule forMarker(String marker, boolean hormoneReceptor) {
            String m = marker.toLowerCase(Locale.ROOT);
            return new InferenceRule(
                marker,
                List.of(m + "+", m + "-positive", m + " positive", m + "pos"),
                List.of(m + "-", m + "-negative", m + " negative", m + "neg"),
                hormoneReceptor
            );
        }

        Optional<String> infer(String corpus) {
            if (ClinicalPhrases.containsAny(corpus, positive)) {
                log.info("Inferred {}: positive from patient text", marker);
                return Optional.of("positive");
            }
            if (ClinicalPhrases.containsAny(corpus, negative)) {
                log.info("Inferred {}: negative from patient text", marker);
                return Optional.of("negative");
            }
            if (ClinicalPhrases.containsAny(corpus, ClinicalPhrases.TNBC)) {
                log.info("Inferred {}: negative from TNBC", marker);
                return Optional.of("negative");
            }
            if (hormoneReceptor && ClinicalPhrases.containsAny(corpus, HORMONE_RECEPTOR_POSITIVE)) {
                log.info("Inferred {}: positive from HR+ status", marker);
                return Optional.of("positive");
            }
            return Optional.empty();
        }
    }
}
