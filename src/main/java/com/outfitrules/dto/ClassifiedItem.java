package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A wardrobe item mapped into the canonical taxonomy. Derived per request.
 */
@Value
@Builder
public class ClassifiedItem {
    String id;
    String name;
    ClothingCategory category;
    String subcategory;
    Silhouette silhouette;
    FormalityLevel formality;
    SeasonType season;
    @Builder.Default
    List<AestheticTag> aestheticTags = List.of();
    String colorFamily;
    boolean hasImage;
    @JsonIgnore
    WardrobeItem source;
}
