package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailOverride;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;
import com.trialguard.model.BiomarkerStatus;

/**
 * HER2 requirement of the trial against the patient's resolved HER2 status.
 */
public class Her2RequirementRule implements GuardrailRule {

    @Override
    public String name() {
        return "her2-requirement";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        String trialText = context.getTrialText();
        BiomarkerStatus her2 = context.getHer2Status();

        boolean requiresPositive = ClinicalPhrases.mentionsHer2Positive(trialText);
        boolean requiresNegative = ClinicalPhrases.mentionsHer2Negative(trialText)
            && !requiresPositive
            && !trialText.contains(ClinicalPhrases.HER2_LOW);

        RuleOutcome.RuleOutcomeBuilder outcome = RuleOutcome.builder();

        if (requiresPositive) {
            if (her2 == BiomarkerStatus.NEGATIVE) {
                outcome.flag("HER2 status mismatch: Trial requires HER2+, patient is HER2-")
                    .override(GuardrailOverride.exclude(15,
                        "Hard exclusion: Patient is HER2-negative but trial requires HER2-positive status. "
                            + "This is a fundamental eligibility criterion."));
            } else if (her2 == BiomarkerStatus.UNKNOWN) {
                outcome.flag("HER2 status unknown: Trial requires HER2+, patient status not documented")
                    .override(GuardrailOverride.uncertain(45,
                        "Uncertain match: HER2 status not documented. Additional testing required to "
                            + "determine eligibility for this HER2-positive trial."));
            }
        }

        if (requiresNegative) {
            if (her2 == BiomarkerStatus.POSITIVE) {
                outcome.flag("HER2 status mismatch: Trial requires HER2-, patient is HER2+")
                    .override(GuardrailOverride.exclude(15,
                        "Hard exclusion: Patient is HER2-positive but trial requires HER2-negative status."));
            } else if (her2 == BiomarkerStatus.UNKNOWN) {
                outcome.flag("HER2 status unknown: Trial requires HER2-, patient status not documented")
                    .override(GuardrailOverride.uncertain(45,
                        "Uncertain match: HER2 status not documented. Additional testing required to "
                            + "determine eligibility for this HER2-negative trial."));
            }
        }

        return outcome.build();
    }
}
