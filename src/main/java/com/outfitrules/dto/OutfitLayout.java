package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutfitLayout {
    SINGLE("1x1"),
    TWO_BY_ONE("2x1"),
    THREE_BY_ONE("3x1"),
    TWO_BY_TWO("2x2");

    private final String code;

    OutfitLayout(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static OutfitLayout forItemCount(int itemCount) {
        return switch (itemCount) {
            case 1 -> SINGLE;
            case 2 -> TWO_BY_ONE;
            case 3 -> THREE_BY_ONE;
            default -> TWO_BY_TWO;
        };
    }
}
