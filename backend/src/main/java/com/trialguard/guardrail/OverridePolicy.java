package com.trialguard.guardrail;

/**
 * How the engine combines overrides from several triggered rules.
 */
public enum OverridePolicy {

    /**
     * Every triggered override replaces the previous one, so the last rule in
     * sequence decides. A later uncertain verdict can therefore replace an
     * earlier exclusion.
     */
    LAST_TRIGGERED {
        @Override
        public GuardrailOverride select(GuardrailOverride current, GuardrailOverride candidate) {
            return candidate;
        }
    },

    /**
     * Exclude beats uncertain beats match; at equal status the lower score wins.
     */
    STRICTEST {
        @Override
        public GuardrailOverride select(GuardrailOverride current, GuardrailOverride candidate) {
            if (current == null) {
                return candidate;
            }
            if (candidate.getStatus().isMoreSevereThan(current.getStatus())) {
                return candidate;
            }
            if (candidate.getStatus() == current.getStatus() && candidate.getScore() < current.getScore()) {
                return candidate;
            }
            return current;
        }
    };

    public abstract GuardrailOverride select(GuardrailOverride current, GuardrailOverride candidate);
}
