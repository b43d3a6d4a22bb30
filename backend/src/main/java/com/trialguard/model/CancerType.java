package com.trialguard.model;

import java.util.Optional;

public enum CancerType {
    BREAST,
    LUNG,
    COLORECTAL,
    PROSTATE,
    OTHER;

    public String code() {
        return name().toLowerCase();
    }

    public static Optional<CancerType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (CancerType type : values()) {
            if (type.code().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
