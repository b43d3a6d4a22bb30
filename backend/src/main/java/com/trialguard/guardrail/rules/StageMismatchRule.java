package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailOverride;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;

/**
 * Metastatic trials for early-stage patients and early-stage trials for metastatic patients.
 */
public class StageMismatchRule implements GuardrailRule {

    @Override
    public String name() {
        return "stage-mismatch";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        String trialText = context.getTrialText();
        RuleOutcome.RuleOutcomeBuilder outcome = RuleOutcome.builder();

        if (ClinicalPhrases.containsAny(trialText, ClinicalPhrases.METASTATIC_TRIAL) && context.isEarlyStage()) {
            outcome.flag("Stage mismatch: Trial for metastatic disease, patient has early-stage cancer")
                .override(GuardrailOverride.exclude(20,
                    "Hard exclusion: Trial is for metastatic/advanced breast cancer, but patient has early-stage disease."));
        }

        if (ClinicalPhrases.containsAny(trialText, ClinicalPhrases.EARLY_STAGE_TRIAL) && context.isMetastatic()) {
            outcome.flag("Stage mismatch: Trial for early-stage disease, patient has metastatic cancer")
                .override(GuardrailOverride.exclude(20,
                    "Hard exclusion: Trial is for early-stage breast cancer, but patient has metastatic disease."));
        }

        return outcome.build();
    }
}
