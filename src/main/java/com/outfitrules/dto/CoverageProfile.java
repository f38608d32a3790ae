package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the wardrobe can support. {@code categories} holds an entry for every canonical
 * category, zero-filled when the wardrobe has none.
 */
@Value
@Builder
public class CoverageProfile {
    Map<ClothingCategory, CategoryCoverage> categories;
    int totalItems;
    int totalWithImages;
    List<OutfitSlot> availableSlots;
    List<OutfitSlot> missingMandatorySlots;
    boolean canCreateCompleteOutfit;

    public CategoryCoverage coverage(ClothingCategory category) {
        return categories.getOrDefault(category, CategoryCoverage.of(0, 0));
    }

    public int count(ClothingCategory category) {
        return coverage(category).getCount();
    }

    public int withImages(ClothingCategory category) {
        return coverage(category).getWithImages();
    }
}
