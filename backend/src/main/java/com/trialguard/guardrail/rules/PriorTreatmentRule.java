package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailOverride;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;

/**
 * Required and forbidden prior therapies.
 */
public class PriorTreatmentRule implements GuardrailRule {

    @Override
    public String name() {
        return "prior-treatment";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        String trialText = context.getTrialText();
        String history = context.getPriorTreatmentText();
        RuleOutcome.RuleOutcomeBuilder outcome = RuleOutcome.builder();

        if (ClinicalPhrases.containsAny(trialText, ClinicalPhrases.REQUIRES_PRIOR_TRASTUZUMAB)
                && !ClinicalPhrases.containsAny(history, ClinicalPhrases.TRASTUZUMAB)) {
            outcome.flag("Prior treatment requirement: Trial requires prior trastuzumab, patient has not received it")
                .override(GuardrailOverride.exclude(25,
                    "Hard exclusion: Trial requires prior trastuzumab therapy, but patient treatment history does not include it."));
        }

        if (ClinicalPhrases.containsAny(trialText, ClinicalPhrases.REQUIRES_PRIOR_TAXANE)
                && !ClinicalPhrases.containsAny(history, ClinicalPhrases.TAXANE)) {
            outcome.flag("Prior treatment requirement: Trial requires prior taxane, patient has not received it")
                .override(GuardrailOverride.exclude(25,
                    "Hard exclusion: Trial requires prior taxane-based therapy, but patient treatment history does not include it."));
        }

        if (ClinicalPhrases.containsAny(context.getExclusionText(), ClinicalPhrases.EXCLUDES_PRIOR_TDM1)
                && ClinicalPhrases.containsAny(history, ClinicalPhrases.TDM1)) {
            outcome.flag("Prior treatment exclusion: Trial excludes prior T-DM1, patient has received it")
                .override(GuardrailOverride.exclude(15,
                    "Hard exclusion: Trial excludes patients with prior T-DM1 therapy, but patient has received it."));
        }

        return outcome.build();
    }
}
