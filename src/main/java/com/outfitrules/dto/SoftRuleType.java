package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SoftRuleType {
    PREFER("prefer"),
    AVOID("avoid");

    private final String code;

    SoftRuleType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
