package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Renderable outfit: at least one grounded wardrobe item with an image.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VisualOutfit {
    String title;
    OutfitLayout layout;
    List<VisualOutfitItem> items;
    @JsonProperty("why_it_works")
    String whyItWorks;
    String occasion;
    String vibe;
}
