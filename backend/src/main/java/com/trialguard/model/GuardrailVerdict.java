package com.trialguard.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of running the guardrail rules against one (patient, trial, AI verdict) triple.
 */
@Value
@Builder
@Jacksonized
public class GuardrailVerdict {

    public static final String NO_OVERRIDE_REASONING = "No guardrail overrides applied";

    boolean shouldOverride;
    Integer overrideScore;
    OverrideStatus overrideStatus;
    @Singular
    List<String> flags;
    String reasoning;
}
