package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SeasonType {
    HOT("hot"),
    MILD("mild"),
    COLD("cold"),
    ALL_SEASON("all-season");

    private final String code;

    SeasonType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static SeasonType fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (SeasonType season : values()) {
            if (season.code.equals(normalized)) {
                return season;
            }
        }
        return null;
    }
}
