package com.trialguard.guardrail.rules;

import com.trialguard.guardrail.GuardrailContext;
import com.trialguard.guardrail.GuardrailRule;
import com.trialguard.guardrail.RuleOutcome;
import com.trialguard.model.BiomarkerStatus;

/**
 * Flags AI explanations that contradict known patient facts. Never overrides.
 */
public class AssessmentConsistencyRule implements GuardrailRule {

    @Override
    public String name() {
        return "assessment-consistency";
    }

    @Override
    public RuleOutcome evaluate(GuardrailContext context) {
        String explanation = context.getAssessmentText();
        BiomarkerStatus her2 = context.getHer2Status();
        RuleOutcome.RuleOutcomeBuilder outcome = RuleOutcome.builder();

        if (her2 == BiomarkerStatus.POSITIVE && explanation.contains("her2-negative")) {
            outcome.flag("AI consistency error: Assessment mentions HER2-negative but patient is HER2-positive");
        }
        if (her2 == BiomarkerStatus.NEGATIVE && explanation.contains("her2-positive")) {
            outcome.flag("AI consistency error: Assessment mentions HER2-positive but patient is HER2-negative");
        }
        if (context.isMetastatic() && explanation.contains("early-stage")) {
            outcome.flag("AI consistency error: Assessment mentions early-stage but patient has metastatic disease");
        }

        return outcome.build();
    }
}
