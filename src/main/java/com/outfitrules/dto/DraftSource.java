package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DraftSource {
    LLM("llm"),
    FALLBACK("fallback");

    private final String code;

    DraftSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static DraftSource fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (DraftSource source : values()) {
            if (source.code.equals(normalized)) {
                return source;
            }
        }
        return null;
    }
}
