package com.trialguard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which kind of match a generated trial was meant to demonstrate.
 * Provenance only, never read by the guardrails.
 */
public enum MatchType {
    PERFECT,
    EXCLUDED,
    UNCERTAIN;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MatchType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (MatchType type : values()) {
            if (type.name().equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        return null;
    }
}
