package com.trialguard.validation;

import com.trialguard.guardrail.BiomarkerStatusResolver;
import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.model.BiomarkerStatus;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.ValidationOutcome;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Catches unrealistic values and medical contradictions in an extracted profile.
 */
@Component
@RequiredArgsConstructor
public class ProfileValidator {

    static final List<String> VALID_STAGES = List.of(
        "I", "IA", "IB", "II", "IIA", "IIB", "III", "IIIA", "IIIB", "IIIC", "IV", "IVA", "IVB");

    private static final Pattern STAGE_WORD = Pattern.compile("STAGE\\s*");
    private static final Set<String> HORMONE_RECEPTORS = Set.of("ER", "PR");

    private final BiomarkerStatusResolver biomarkerResolver;

    public ValidationOutcome validateProfile(PatientProfile profile) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (profile == null) {
            errors.add("Patient profile is missing");
            return new ValidationOutcome(errors, warnings);
        }

        int age = profile.getAge();
        if (age == 0) {
            warnings.add("Age not extracted, defaulting to unknown");
        } else if (age < 18) {
            errors.add("Age " + age + " is below minimum (18 years)");
        } else if (age > 120) {
            errors.add("Age " + age + " is unrealistic (max 120 years)");
        }

        List<String> conditions = profile.getConditions();

        if (profile.hasStage()) {
            String stage = STAGE_WORD.matcher(profile.getStage().toUpperCase(Locale.ROOT)).replaceFirst("").trim();
            if (VALID_STAGES.stream().noneMatch(stage::startsWith)) {
                errors.add("Invalid cancer stage: \"" + profile.getStage() + "\". Must be I, II, III, or IV");
            }
            if (stage.equals("0") && ClinicalPhrases.anyContains(conditions, List.of("metastatic"))) {
                errors.add("Impossible combination: Stage 0 cannot be metastatic");
            }
        }

        if (profile.getPerformanceStatus() != null) {
            Matcher ecog = ClinicalPhrases.ECOG_SCORE.matcher(profile.getPerformanceStatus());
            if (ecog.find()) {
                int score = Integer.parseInt(ecog.group(1));
                if (score > 5) {
                    errors.add("Invalid ECOG score: " + score + ". Must be 0-5");
                }
            }
        }

        if (ClinicalPhrases.anyContains(conditions, ClinicalPhrases.TNBC) && hasPositiveReceptor(profile.getBiomarkers())) {
            errors.add("Biomarker contradiction: Triple Negative Breast Cancer cannot be HER2+, ER+, or PR+");
        }

        if (conditions.isEmpty()) {
            warnings.add("No conditions/diagnoses extracted from patient notes");
        }
        if (!profile.hasStage() && ClinicalPhrases.anyContains(conditions, List.of("cancer"))) {
            warnings.add("Cancer stage not specified - may limit trial matching accuracy");
        }
        if (profile.getBiomarkers().isEmpty() && ClinicalPhrases.anyContains(conditions, List.of("breast cancer"))) {
            warnings.add("No biomarkers (HER2, ER, PR) extracted - critical for breast cancer trial matching");
        }

        return new ValidationOutcome(errors, warnings);
    }

    // HER2 is matched by key substring, as the guardrails do; ER and PR need an exact key
    private boolean hasPositiveReceptor(Map<String, String> biomarkers) {
        if (biomarkerResolver.resolve(biomarkers, "HER2") == BiomarkerStatus.POSITIVE) {
            return true;
        }
        for (Map.Entry<String, String> entry : biomarkers.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            String key = entry.getKey().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "");
            if (HORMONE_RECEPTORS.contains(key) && biomarkerResolver.classify(entry.getValue()) == BiomarkerStatus.POSITIVE) {
                return true;
            }
        }
        return false;
    }
}
