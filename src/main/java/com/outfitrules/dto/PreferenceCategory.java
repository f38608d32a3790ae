package com.outfitrules.dto;

/**
 * Source categories of preference statements, each with its fixed rule weight.
 */
public enum PreferenceCategory {
    VALID_PAIRS("valid", 0.6, SoftRuleType.PREFER, "Suggested pairing that works well"),
    AVOID_PAIRS("avoid", 0.7, SoftRuleType.AVOID, "Suggested pairing to avoid"),
    CORE_DIRECTIONS("direction", 0.5, SoftRuleType.PREFER, "Aligns with overall styling direction"),
    COLOR_RULES("color", 0.55, SoftRuleType.PREFER, "Color styling guidance"),
    SILHOUETTE_RULES("silhouette", 0.45, SoftRuleType.PREFER, "Silhouette guidance"),
    BODY_TYPE_RULES("body", 0.5, SoftRuleType.PREFER, "Body type styling guidance"),
    GENDER_NOTES("gender", 0.4, SoftRuleType.PREFER, "Gender-aware styling");

    private final String idPrefix;
    private final double weight;
    private final SoftRuleType defaultType;
    private final String explanation;

    PreferenceCategory(String idPrefix, double weight, SoftRuleType defaultType, String explanation) {
        this.idPrefix = idPrefix;
        this.weight = weight;
        this.defaultType = defaultType;
        this.explanation = explanation;
    }

    public String idPrefix() {
        return idPrefix;
    }

    public double weight() {
        return weight;
    }

    public SoftRuleType defaultType() {
        return defaultType;
    }

    public String explanation() {
        return explanation;
    }
}
