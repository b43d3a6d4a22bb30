package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.ClinicalPhrases;
import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailOverride;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;

public class BrainMetastasesRule implements GuardrailRule {

    @Override
    public String name() {
        return "brain-metastases";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        if (!ClinicalPhrases.containsAny(context.getExclusionText(), ClinicalPhrases.EXCLUDES_BRAIN_METS)) {
            return RuleOutcome.none();
        }
        // Brain-directed therapy (e.g. whole-brain radiation) counts as documented CNS involvement
        boolean hasBrainMets = ClinicalPhrases.anyContains(context.getPatient().getConditions(), ClinicalPhrases.BRAIN_METS_CONDITION)
            || ClinicalPhrases.containsAny(context.getPriorTreatmentText(), ClinicalPhrases.BRAIN_TREATMENT);
        if (!hasBrainMets) {
            return RuleOutcome.none();
        }
        return RuleOutcome.builder()
            .flag("Brain metastases: Trial excludes brain/CNS metastases, patient has them")
            .override(GuardrailOverride.exclude(20,
                "Hard exclusion: Trial excludes patients with brain metastases, but patient has documented CNS involvement."))
            .build();
    }
}
