package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailOverride;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;
import com.trialguard.model.BiomarkerStatus;

/**
 * A TNBC trial cannot enroll a HER2-positive patient.
 */
public class TnbcSubtypeRule implements GuardrailRule {

    @Override
    public String name() {
        return "tnbc-subtype";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        boolean trialForTnbc = ClinicalPhrases.containsAny(context.getTrialText(), ClinicalPhrases.TNBC);
        if (!trialForTnbc || context.isTripleNegative() || context.getHer2Status() != BiomarkerStatus.POSITIVE) {
            return RuleOutcome.none();
        }
        return RuleOutcome.builder()
            .flag("Subtype mismatch: Trial for TNBC, patient is HER2+")
            .override(GuardrailOverride.exclude(15,
                "Hard exclusion: Trial is for triple-negative breast cancer, but patient is HER2-positive."))
            .build();
    }
}
