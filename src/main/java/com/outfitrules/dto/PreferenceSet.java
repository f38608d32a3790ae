package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Stream;

/**
 * Free-text styling preferences from the preference source, grouped by category.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PreferenceSet {
    @JsonProperty("valid_pairs")
    @Builder.Default
    List<String> validPairs = List.of();
    @JsonProperty("avoid_pairs")
    @Builder.Default
    List<String> avoidPairs = List.of();
    @JsonProperty("strong_outfit_bases")
    @Builder.Default
    List<String> strongOutfitBases = List.of();
    @JsonProperty("core_directions")
    @Builder.Default
    List<String> coreDirections = List.of();
    @JsonProperty("color_rules")
    @Builder.Default
    List<String> colorRules = List.of();
    @JsonProperty("silhouette_rules")
    @Builder.Default
    List<String> silhouetteRules = List.of();
    @JsonProperty("body_type_rules")
    @Builder.Default
    List<String> bodyTypeRules = List.of();
    @JsonProperty("gender_style_notes")
    @Builder.Default
    List<String> genderStyleNotes = List.of();

    public List<String> statements(PreferenceCategory category) {
        List<String> statements = switch (category) {
            case VALID_PAIRS -> validPairs;
            case AVOID_PAIRS -> avoidPairs;
            case CORE_DIRECTIONS -> coreDirections;
            case COLOR_RULES -> colorRules;
            case SILHOUETTE_RULES -> silhouetteRules;
            case BODY_TYPE_RULES -> bodyTypeRules;
            case GENDER_NOTES -> genderStyleNotes;
        };
        return statements != null ? statements : List.of();
    }

    /** True when no category would produce a rule. */
    @JsonIgnore
    public boolean isEmpty() {
        return Stream.of(PreferenceCategory.values()).allMatch(c -> statements(c).isEmpty());
    }
}
