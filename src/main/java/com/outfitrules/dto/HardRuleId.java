package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifiers of the hard rules. A rule that is not {@code relaxable} keeps its block
 * severity even in a relaxed evaluation pass.
 */
public enum HardRuleId {
    MANDATORY_SLOTS("mandatory_slots", false),
    FORMALITY_MISMATCH_FOOTWEAR("formality_mismatch_footwear", false),
    FORMALITY_OCCASION_MISMATCH("formality_occasion_mismatch", true),
    FORMALITY_GENERAL_MISMATCH("formality_general_mismatch", true),
    SILHOUETTE_MISMATCH("silhouette_mismatch", true),
    ETHNIC_COHERENCE("ethnic_coherence", false),
    CLIMATE_HEAVY_LAYERING("climate_heavy_layering", true),
    CLIMATE_TOO_LIGHT("climate_too_light", true),
    DUPLICATE_ITEMS("duplicate_items", false),
    WARDROBE_UPPER_MISSING("wardrobe_upper_missing", true),
    WARDROBE_LOWER_MISSING("wardrobe_lower_missing", true),
    WARDROBE_FOOTWEAR_MISSING("wardrobe_footwear_missing", true);

    private final String code;
    private final boolean relaxable;

    HardRuleId(String code, boolean relaxable) {
        this.code = code;
        this.relaxable = relaxable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isRelaxable() {
        return relaxable;
    }

    public static HardRuleId fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase().replace('-', '_');
        for (HardRuleId id : values()) {
            if (id.code.equals(normalized)) {
                return id;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return code;
    }
}
