package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of answer the caller is building. Only {@link #VISUAL_OUTFIT} requires every
 * mandatory slot to reference the wardrobe.
 */
public enum ResponseMode {
    VISUAL_OUTFIT("visual_outfit"),
    ADVISORY_TEXT("advisory_text"),
    SHOPPING_COMPARISON("shopping_comparison"),
    MIXED("mixed");

    private final String code;

    ResponseMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ResponseMode fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (ResponseMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
