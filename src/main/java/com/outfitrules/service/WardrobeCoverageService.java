package com.outfitrules.service;

import com.outfitrules.dto.CategoryCoverage;
import com.outfitrules.dto.ClassifiedItem;
import com.outfitrules.dto.ClothingCategory;
import com.outfitrules.dto.CoverageProfile;
import com.outfitrules.dto.OutfitSlot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.outfitrules.dto.ClothingCategory.ACCESSORIES;
import static com.outfitrules.dto.ClothingCategory.BOTTOMS;
import static com.outfitrules.dto.ClothingCategory.DRESSES;
import static com.outfitrules.dto.ClothingCategory.FOOTWEAR;
import static com.outfitrules.dto.ClothingCategory.OUTERWEAR;
import static com.outfitrules.dto.ClothingCategory.TOPS;

@Service
public class WardrobeCoverageService {

    public CoverageProfile profile(List<ClassifiedItem> items) {
        List<ClassifiedItem> wardrobe = items == null ? List.of()
            : items.stream().filter(Objects::nonNull).toList();

        Map<ClothingCategory, CategoryCoverage> categories = new EnumMap<>(ClothingCategory.class);
        for (ClothingCategory category : ClothingCategory.values()) {
            List<ClassifiedItem> inCategory = wardrobe.stream()
                .filter(item -> item.getCategory() == category)
                .toList();
            int withImages = (int) inCategory.stream().filter(ClassifiedItem::isHasImage).count();
            categories.put(category, CategoryCoverage.of(inCategory.size(), withImages));
        }

        int tops = categories.get(TOPS).getCount();
        int bottoms = categories.get(BOTTOMS).getCount();
        int dresses = categories.get(DRESSES).getCount();
        int footwear = categories.get(FOOTWEAR).getCount();

        List<OutfitSlot> missing = new ArrayList<>();
        if (tops == 0 && dresses == 0) {
            missing.add(OutfitSlot.UPPER_WEAR);
        }
        if (bottoms == 0 && dresses == 0) {
            missing.add(OutfitSlot.LOWER_WEAR);
        }
        // dresses never stand in for shoes
        if (footwear == 0) {
            missing.add(OutfitSlot.FOOTWEAR);
        }

        List<OutfitSlot> available = new ArrayList<>();
        if (tops > 0 || dresses > 0) {
            available.add(OutfitSlot.UPPER_WEAR);
        }
        if (bottoms > 0) {
            available.add(OutfitSlot.LOWER_WEAR);
        }
        if (footwear > 0) {
            available.add(OutfitSlot.FOOTWEAR);
        }
        if (categories.get(OUTERWEAR).getCount() > 0) {
            available.add(OutfitSlot.LAYERING);
        }
        if (categories.get(ACCESSORIES).getCount() > 0) {
            available.add(OutfitSlot.ACCESSORIES);
        }

        return CoverageProfile.builder()
            .categories(Collections.unmodifiableMap(categories))
            .totalItems(wardrobe.size())
            .totalWithImages((int) wardrobe.stream().filter(ClassifiedItem::isHasImage).count())
            .availableSlots(List.copyOf(available))
            .missingMandatorySlots(List.copyOf(missing))
            .canCreateCompleteOutfit(missing.isEmpty())
            .build();
    }

    /**
     * A complete outfit is possible and every mandatory slot has at least one item with an
     * image to show.
     */
    public boolean canSupportVisualOutfits(CoverageProfile profile) {
        return profile.isCanCreateCompleteOutfit()
            && profile.withImages(TOPS) + profile.withImages(DRESSES) > 0
            && (profile.withImages(BOTTOMS) > 0 || profile.withImages(DRESSES) > 0)
            && profile.withImages(FOOTWEAR) > 0;
    }

    public double confidenceScore(CoverageProfile profile) {
        double score = 0.0;
        int total = profile.getTotalItems();
        if (total >= 10) {
            score += 0.3;
        } else if (total >= 5) {
            score += 0.2;
        } else if (total > 0) {
            score += 0.1;
        }

        if (profile.count(TOPS) > 0 || profile.count(DRESSES) > 0) {
            score += 0.2;
        }
        if (profile.count(BOTTOMS) > 0 || profile.count(DRESSES) > 0) {
            score += 0.2;
        }
        if (profile.count(FOOTWEAR) > 0) {
            score += 0.2;
        }
        if (profile.count(OUTERWEAR) > 0) {
            score += 0.05;
        }
        if (profile.count(ACCESSORIES) > 0) {
            score += 0.05;
        }
        return Math.min(1.0, score);
    }

    /** Empty when the wardrobe can build a complete outfit. */
    public String coverageWarning(CoverageProfile profile) {
        if (profile.isCanCreateCompleteOutfit()) {
            return "";
        }
        String missing = profile.getMissingMandatorySlots().stream()
            .map(OutfitSlot::code)
            .collect(Collectors.joining(", "));
        return "Wardrobe cannot fill mandatory slots: " + missing;
    }
}
