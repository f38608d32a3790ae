package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CoverageLevel {
    NONE("none"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private static final int LOW_THRESHOLD = 1;
    private static final int MEDIUM_THRESHOLD = 3;
    private static final int HIGH_THRESHOLD = 5;

    private final String code;

    CoverageLevel(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /** Monotonic in {@code count}. */
    public static CoverageLevel fromCount(int count) {
        if (count >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (count >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        if (count >= LOW_THRESHOLD) {
            return LOW;
        }
        return NONE;
    }
}
