package com.trialguard.guardrail;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a single rule contributed: flags to append and overrides in the order they tripped.
 */
@Value
@Builder
public class RuleOutcome {

    @Singular
    List<String> flags;

    @Singular
    List<GuardrailOverride> overrides;

    public static RuleOutcome none() {
        return RuleOutcome.builder().build();
    }
}
