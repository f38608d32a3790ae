package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Raw wardrobe record as supplied by the wardrobe provider. Every field may be missing.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class WardrobeItem {
    String id;
    String name;
    String category;
    @JsonProperty("item_type")
    String itemType;
    String color;
    @JsonProperty("primary_color")
    String primaryColor;
    String fabric;
    String fit;
    String formality;
    @Builder.Default
    List<String> seasons = List.of();
    @JsonProperty("style_aesthetic")
    @Builder.Default
    List<String> styleAesthetic = List.of();
    @Builder.Default
    List<String> occasions = List.of();
    @JsonProperty("image_url")
    String imageUrl;
    @JsonProperty("processed_image_url")
    String processedImageUrl;

    /** Processed image when available, else the original upload; {@code null} if neither. */
    @JsonIgnore
    public String getDisplayImageUrl() {
        if (processedImageUrl != null && !processedImageUrl.isBlank()) {
            return processedImageUrl;
        }
        if (imageUrl != null && !imageUrl.isBlank()) {
            return imageUrl;
        }
        return null;
    }

    @JsonIgnore
    public boolean hasImage() {
        return getDisplayImageUrl() != null;
    }
}
