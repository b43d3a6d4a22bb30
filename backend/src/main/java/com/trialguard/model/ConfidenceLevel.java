package com.trialguard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ConfidenceLevel fromCode(String code) {
        if (code == null) {
            return LOW;
        }
        for (ConfidenceLevel level : values()) {
            if (level.name().equalsIgnoreCase(code.trim())) {
                return level;
            }
        }
        return LOW;
    }
}
