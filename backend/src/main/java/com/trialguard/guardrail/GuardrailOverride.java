package com.trialguard.guardrail;

import com.trialguard.model.OverrideStatus;
import lombok.Value;

/**
 * A score and status a rule wants to force onto the match, with the reason shown to clinicians.
 */
@Value
public class GuardrailOverride {

    OverrideStatus status;
    int score;
    String reasoning;

    public static GuardrailOverride exclude(int score, String reasoning) {
        return new GuardrailOverride(OverrideStatus.EXCLUDE, score, reasoning);
    }

    public static GuardrailOverride uncertain(int score, String reasoning) {
        return new GuardrailOverride(OverrideStatus.UNCERTAIN, score, reasoning);
    }
}
