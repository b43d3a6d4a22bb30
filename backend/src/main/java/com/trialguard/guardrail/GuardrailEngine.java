package com.trialguard.guardrail;

import com.trialguard.guardrail.rules.AssessmentConsistencyRule;
import com.trialguard.guardrail.rules.BrainMetastasesRule;
import com.trialguard.guardrail.rules.EcogRequirementRule;
import com.trialguard.guardrail.rules.Her2RequirementRule;
import com.trialguard.guardrail.rules.PriorTreatmentRule;
import com.trialguard.guardrail.rules.StageMismatchRule;
import com.trialguard.guardrail.rules.TnbcSubtypeRule;
import com.trialguard.model.AiVerdict;
import com.trialguard.model.GuardrailVerdict;
import com.trialguard.model.PatientProfile;
import com.trialguard.model.TrialRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic clinical guardrails layered over the AI eligibility assessment.
 *
 * Rules run in a fixed order and every rule runs on every evaluation. Flags from
 * all triggered rules accumulate; the override fields are decided by the
 * configured {@link OverridePolicy}.
 */
@Slf4j
public class GuardrailEngine {

    private final BiomarkerStatusResolver biomarkerResolver;
    private final OverridePolicy overridePolicy;
    private final List<GuardrailRule> rules;

    public GuardrailEngine(BiomarkerStatusResolver biomarkerResolver, OverridePolicy overridePolicy) {
        this(biomarkerResolver, overridePolicy, defaultRules());
    }

    GuardrailEngine(BiomarkerStatusResolver biomarkerResolver, OverridePolicy overridePolicy, List<GuardrailRule> rules) {
        this.biomarkerResolver = biomarkerResolver;
        this.overridePolicy = overridePolicy;
        this.rules = List.copyOf(rules);
    }

    /**
     * Evaluation order matters: with {@link OverridePolicy#LAST_TRIGGERED} the
     * last tripped rule decides the override.
     */
    public static List<GuardrailRule> defaultRules() {
        return List.of(
            new Her2RequirementRule(),
            new StageMismatchRule(),
            new PriorTreatmentRule(),
            new EcogRequirementRule(),
            new TnbcSubtypeRule(),
            new BrainMetastasesRule(),
            new AssessmentConsistencyRule()
        );
    }

    public GuardrailVerdict applyGuardrails(PatientProfile patient, TrialRecord trial, AiVerdict verdict) {
        GuardrailContext context = GuardrailContext.of(biomarkerResolver, patient, trial, verdict);

        List<String> flags = new ArrayList<>();
        GuardrailOverride decided = null;

        for (GuardrailRule rule : rules) {
            RuleOutcome outcome;
            try {
                outcome = rule.evaluate(context);
            } catch (RuntimeException e) {
                log.error("Guardrail {} failed for trial {}: {}", rule.name(), context.getTrial().getNctId(), e.getMessage(), e);
                flags.add("Guardrail " + rule.name() + " could not be evaluated - manual review required");
                continue;
            }
            flags.addAll(outcome.getFlags());
            for (GuardrailOverride override : outcome.getOverrides()) {
                decided = overridePolicy.select(decided, override);
            }
        }

        if (decided == null) {
            return GuardrailVerdict.builder()
                .shouldOverride(false)
                .flags(flags)
                .reasoning(GuardrailVerdict.NO_OVERRIDE_REASONING)
                .build();
        }

        log.debug("Guardrail override for trial {}: {} ({})", context.getTrial().getNctId(),
            decided.getStatus(), decided.getScore());
        return GuardrailVerdict.builder()
            .shouldOverride(true)
            .overrideScore(decided.getScore())
            .overrideStatus(decided.getStatus())
            .flags(flags)
            .reasoning(decided.getReasoning())
            .build();
    }

    public OverridePolicy getOverridePolicy() {
        return overridePolicy;
    }

    public List<GuardrailRule> getRules() {
        return rules;
    }
}
