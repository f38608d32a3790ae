package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Canonical clothing taxonomy. Each category owns its subcategory vocabulary and the
 * subcategory assumed when nothing in the item text matches.
 */
public enum ClothingCategory {
    TOPS("tops", "t-shirt",
        List.of("t-shirt", "shirt", "blouse", "sweater", "hoodie", "tank", "polo", "crop-top", "kurta-top")),
    BOTTOMS("bottoms", "jeans",
        List.of("jeans", "trousers", "shorts", "skirt", "leggings", "cargo", "chinos", "palazzos")),
    FOOTWEAR("footwear", "sneakers",
        List.of("sneakers", "loafers", "heels", "boots", "sandals", "flats", "slides", "flip-flops", "formal-shoes")),
    OUTERWEAR("outerwear", "jacket",
        List.of("jacket", "blazer", "coat", "cardigan", "puffer", "windbreaker", "shrug")),
    ACCESSORIES("accessories", "bag",
        List.of("bag", "belt", "watch", "jewelry", "scarf", "hat", "sunglasses")),
    ETHNIC("ethnic", "kurta",
        List.of("kurta", "saree", "lehenga", "sherwani", "salwar", "dupatta", "dhoti")),
    SPORTSWEAR("sportswear", "track-pants",
        List.of("track-pants", "sports-bra", "gym-shorts", "athletic-top")),
    FORMALWEAR("formalwear", "formal-shirt",
        List.of("suit", "blazer-formal", "formal-shirt", "formal-trousers")),
    DRESSES("dresses", "casual-dress",
        List.of("casual-dress", "formal-dress", "maxi", "midi", "mini", "gown"));

    private final String code;
    private final String defaultSubcategory;
    private final List<String> subcategories;

    ClothingCategory(String code, String defaultSubcategory, List<String> subcategories) {
        this.code = code;
        this.defaultSubcategory = defaultSubcategory;
        this.subcategories = subcategories;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String defaultSubcategory() {
        return defaultSubcategory;
    }

    /** Vocabulary in match priority order. */
    public List<String> subcategories() {
        return subcategories;
    }

    @JsonCreator
    public static ClothingCategory fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase();
        for (ClothingCategory category : values()) {
            if (category.code.equals(normalized)) {
                return category;
            }
        }
        return null;
    }
}
