package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleSeverity {
    /** Terminal: the draft is not allowed. */
    BLOCK("block"),
    /** Allowed, but penalised in ranking. */
    WARN("warn");

    private final String code;

    RuleSeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
