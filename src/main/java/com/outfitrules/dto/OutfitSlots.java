package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Slot assignments of a draft. Accessories is the only multi-valued slot.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutfitSlots {
    @JsonProperty("upper_wear")
    SlotItem upperWear;
    @JsonProperty("lower_wear")
    SlotItem lowerWear;
    SlotItem footwear;
    SlotItem layering;
    @Builder.Default
    List<SlotItem> accessories = List.of();

    /** The single-valued slot's item, or {@code null}; accessories yields its first entry. */
    public SlotItem get(OutfitSlot slot) {
        return switch (slot) {
            case UPPER_WEAR -> upperWear;
            case LOWER_WEAR -> lowerWear;
            case FOOTWEAR -> footwear;
            case LAYERING -> layering;
            case ACCESSORIES -> accessories == null || accessories.isEmpty() ? null : accessories.get(0);
        };
    }

    public boolean isFilled(OutfitSlot slot) {
        return get(slot) != null;
    }

    /** Every non-null item in slot order, accessories last. */
    @JsonIgnore
    public List<SlotItem> itemsInSlotOrder() {
        List<SlotItem> items = new ArrayList<>();
        for (SlotItem item : new SlotItem[] {upperWear, lowerWear, footwear, layering}) {
            if (item != null) {
                items.add(item);
            }
        }
        if (accessories != null) {
            accessories.stream().filter(Objects::nonNull).forEach(items::add);
        }
        return items;
    }

    public static OutfitSlots empty() {
        return OutfitSlots.builder().build();
    }
}
