package com.trialguard.guardrail;

import com.trialguard.model.AiVerdict;
import com.trialguard.model.BiomarkerStatus;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Facts derived once per evaluation and shared by every rule.
 */
@Value
public class GuardrailContext {

    private static final Pattern EARLY_STAGE = Pattern.compile("stage\\s*(i|ii|iii)", Pattern.CASE_INSENSITIVE);

    PatientProfile patient;
    TrialRecord trial;
    AiVerdict verdict;

    BiomarkerStatus her2Status;

    /** Title, summary and inclusion criteria, lower-cased. */
    String trialText;
    String exclusionText;

    boolean metastatic;
    boolean earlyStage;
    boolean tripleNegative;

    String priorTreatmentText;

    /** Null when the profile carries no parsable ECOG score. */
    Integer ecogScore;

    String assessmentText;

    public static GuardrailContext of(BiomarkerStatusResolver resolver, PatientProfile patient,
                                      TrialRecord trial, AiVerdict verdict) {
        PatientProfile p = patient != null ? patient : PatientProfile.empty();
        TrialRecord t = trial != null ? trial : TrialRecord.builder().build();
        AiVerdict v = verdict != null ? verdict : AiVerdict.builder().build();

        List<String> trialParts = new ArrayList<>();
        trialParts.add(t.getTitle());
        trialParts.add(t.getBriefSummary());
        trialParts.addAll(t.getInclusionCriteria());

        String stage = p.getStage() != null ? p.getStage().toLowerCase(Locale.ROOT) : "";
        boolean metastatic = stage.contains("iv")
            || stage.contains("metastatic")
            || ClinicalPhrases.anyContains(p.getConditions(), List.of("metastatic"));
        boolean earlyStage = EARLY_STAGE.matcher(stage).find() && !metastatic;

        return new GuardrailContext(
            p,
            t,
            v,
            resolver.resolve(p.getBiomarkers(), "HER2"),
            ClinicalPhrases.corpus(trialParts),
            ClinicalPhrases.corpus(t.getExclusionCriteria()),
            metastatic,
            earlyStage,
            ClinicalPhrases.anyContains(p.getConditions(), ClinicalPhrases.TNBC),
            ClinicalPhrases.corpus(p.getPriorTreatments()),
            parseEcog(p.getPerformanceStatus()),
            v.getExplanation().toLowerCase(Locale.ROOT)
        );
    }

    private static Integer parseEcog(String performanceStatus) {
        if (performanceStatus == null) {
            return null;
        }
        Matcher matcher = ClinicalPhrases.ECOG_SCORE.matcher(performanceStatus);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }
}
