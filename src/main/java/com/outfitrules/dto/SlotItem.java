package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One item proposed for a slot: a free-text hint plus whatever attributes the generator
 * supplied. Nothing here is guaranteed to be present.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlotItem {
    String itemId;
    String hint;
    String category;
    String subcategory;
    Silhouette silhouette;
    FormalityLevel formality;
    SeasonType season;
    @Builder.Default
    List<String> aestheticTags = List.of();
    String colorFamily;

    public boolean hasHint() {
        return hint != null && !hint.isBlank();
    }

    public boolean hasItemId() {
        return itemId != null && !itemId.isBlank();
    }
}
