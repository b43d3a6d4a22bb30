package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailOverride;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;

public class EcogRequirementRule implements GuardrailRule {

    @Override
    public String name() {
        return "ecog-requirement";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        Integer ecog = context.getEcogScore();
        if (ecog == null || ecog <= 1 || !ClinicalPhrases.containsAny(context.getTrialText(), ClinicalPhrases.ECOG_0_TO_1)) {
            return RuleOutcome.none();
        }
        return RuleOutcome.builder()
            .flag("ECOG performance status: Trial requires ECOG 0-1, patient is ECOG " + ecog)
            .override(GuardrailOverride.exclude(30,
                "Hard exclusion: Trial requires ECOG performance status 0-1, but patient has ECOG " + ecog + "."))
            .build();
    }
}
