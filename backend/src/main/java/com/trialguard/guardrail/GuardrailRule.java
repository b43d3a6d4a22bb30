package com.trialguard.guardrail;

/**
 * One deterministic eligibility check. Implementations must be pure.
 */
public interface GuardrailRule {

    String name();

    RuleOutcome evaluate(GuardrailContext context);
}
