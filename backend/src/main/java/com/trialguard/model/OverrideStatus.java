package com.trialguard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Eligibility status a guardrail can force onto a trial match.
 * Declared from least to most severe.
 */
public enum OverrideStatus {
    MATCH,
    UNCERTAIN,
    EXCLUDE;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OverrideStatus fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (OverrideStatus status : values()) {
            if (status.name().equalsIgnoreCase(code.trim())) {
                return status;
            }
        }
        return null;
    }

    public boolean isMoreSevereThan(OverrideStatus other) {
        return other == null || ordinal() > other.ordinal();
    }
}
