package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Display layer of a grounded item; lower priority renders first.
 */
public enum OutfitItemLayer {
    OUTER("outer", 1),
    TOP("top", 2),
    DRESS("dress", 2),
    ONE_PIECE("one-piece", 2),
    BOTTOM("bottom", 3),
    SHOES("shoes", 4),
    ACCESSORY("accessory", 5);

    private final String code;
    private final int priority;

    OutfitItemLayer(String code, int priority) {
        this.code = code;
        this.priority = priority;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int priority() {
        return priority;
    }
}
