package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Named positions in an outfit. Declaration order is the slot order used for grounding.
 */
public enum OutfitSlot {
    UPPER_WEAR("upper_wear"),
    LOWER_WEAR("lower_wear"),
    FOOTWEAR("footwear"),
    LAYERING("layering"),
    ACCESSORIES("accessories");

    public static final List<OutfitSlot> MANDATORY = List.of(UPPER_WEAR, LOWER_WEAR, FOOTWEAR);

    private final String code;

    OutfitSlot(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
