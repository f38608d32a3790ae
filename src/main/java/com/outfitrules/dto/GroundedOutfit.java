package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of grounding one draft. {@code visualOutfit} is {@code null} when no hint
 * resolved to a wardrobe item.
 */
@Value
@Builder
public class GroundedOutfit {
    String draftId;
    VisualOutfit visualOutfit;
    List<String> groundedHints;
    List<String> ungroundedHints;
    double groundingPercentage;

    public boolean isRenderable() {
        return visualOutfit != null && !visualOutfit.getItems().isEmpty();
    }
}
