package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Silhouette {
    SLIM("slim"),
    REGULAR("regular"),
    RELAXED("relaxed"),
    LONGLINE("longline"),
    OVERSIZED("oversized");

    private final String code;

    Silhouette(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Silhouette fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (Silhouette silhouette : values()) {
            if (silhouette.code.equals(normalized)) {
                return silhouette;
            }
        }
        return null;
    }
}
