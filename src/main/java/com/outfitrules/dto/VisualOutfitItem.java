package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VisualOutfitItem {
    String id;
    String name;
    @JsonProperty("image_url")
    String imageUrl;
    OutfitItemLayer layer;
}
