package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Strictness {
    RELAXED("relaxed"),
    NORMAL("normal"),
    STRICT("strict");

    private final String code;

    Strictness(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Strictness fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (Strictness strictness : values()) {
            if (strictness.code.equals(normalized)) {
                return strictness;
            }
        }
        return null;
    }
}
