package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Four-level formality ordinal: casual &lt; smart-casual &lt; smart &lt; formal.
 */
public enum FormalityLevel {
    CASUAL("casual"),
    SMART_CASUAL("smart-casual"),
    SMART("smart"),
    FORMAL("formal");

    private final String code;

    FormalityLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Levels are compatible when equal or directly adjacent in the chain. Two steps apart
     * (casual with smart) is incompatible.
     */
    public boolean isCompatibleWith(FormalityLevel other) {
        return other != null && Math.abs(ordinal() - other.ordinal()) <= 1;
    }

    @JsonCreator
    public static FormalityLevel fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (FormalityLevel level : values()) {
            if (level.code.equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
