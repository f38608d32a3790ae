package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Style-category labels with the garment keywords that signal each one.
 */
public enum AestheticTag {
    STREETWEAR("streetwear", List.of("hoodie", "sneaker", "cargo", "oversized", "graphic", "jogger")),
    MINIMAL("minimal", List.of("clean", "simple", "neutral", "basic", "understated", "monochrome")),
    PREPPY("preppy", List.of("polo", "chino", "loafer", "oxford", "button-down", "blazer")),
    ETHNIC("ethnic", List.of("kurta", "saree", "lehenga", "traditional", "embroidered")),
    BOHEMIAN("bohemian", List.of("flowy", "print", "maxi", "fringe", "earthy", "layered")),
    SPORTY("sporty", List.of("athletic", "track", "sneaker", "jersey", "performance")),
    ELEGANT("elegant", List.of("silk", "satin", "heel", "refined", "sophisticated", "tailored")),
    EDGY("edgy", List.of("leather", "black", "chain", "distressed", "bold", "statement")),
    CLASSIC("classic", List.of("timeless", "tailored", "neutral", "structured", "polished")),
    TRENDY("trendy", List.of("current", "fashion-forward", "statement", "bold"));

    private final String code;
    private final List<String> keywords;

    AestheticTag(String code, List<String> keywords) {
        this.code = code;
        this.keywords = keywords;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public List<String> keywords() {
        return keywords;
    }

    @JsonCreator
    public static AestheticTag fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (AestheticTag tag : values()) {
            if (tag.code.equals(normalized)) {
                return tag;
            }
        }
        return null;
    }
}
