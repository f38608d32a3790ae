package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Climate {
    HOT("hot"),
    MILD("mild"),
    COLD("cold");

    private final String code;

    Climate(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Climate fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (Climate climate : values()) {
            if (climate.code.equals(normalized)) {
                return climate;
            }
        }
        return null;
    }
}
