package com.trialguard.model;

import java.util.Optional;

public enum TrialPhase {
    PHASE_1("Phase 1"),
    PHASE_2("Phase 2"),
    PHASE_3("Phase 3");

    private final String label;

    TrialPhase(String label) {
        this.label = label;
    }

    public static Optional<TrialPhase> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (TrialPhase phase : values()) {
            if (phase.label.equals(label)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}
