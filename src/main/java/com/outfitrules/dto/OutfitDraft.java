package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A candidate outfit proposed by the external generator, before validation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutfitDraft {
    String id;
    String title;
    @Builder.Default
    OutfitSlots slots = OutfitSlots.empty();
    @JsonProperty("why_it_works")
    String whyItWorks;
    String occasion;
    String vibe;
    @Builder.Default
    DraftSource source = DraftSource.LLM;

    /** Never {@code null}, even when the generator sent a draft without slots. */
    public OutfitSlots getSlots() {
        return slots != null ? slots : OutfitSlots.empty();
    }
}
