package com.outfitrules.service;

import com.outfitrules.dto.AestheticTag;
import com.outfitrules.dto.ClassifiedItem;
import com.outfitrules.dto.ClothingCategory;
import com.outfitrules.dto.FormalityLevel;
import com.outfitrules.dto.SeasonType;
import com.outfitrules.dto.Silhouette;
import com.outfitrules.dto.WardrobeItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Maps raw wardrobe records into the canonical taxonomy. Total: every record, however
 * sparse, yields exactly one {@link ClassifiedItem}.
 */
@Slf4j
@Service
public class ItemClassifierService {

    /**
     * Category cascade in priority order. The first rule whose predicate holds decides the
     * category; {@link ClothingCategory#TOPS} when none does.
     */
    private static final List<CategoryRule> CATEGORY_RULES = List.of(
        new CategoryRule("ethnic-item-type", ClothingCategory.ETHNIC,
            t -> containsAny(t.itemType(), "kurta", "saree", "lehenga")),
        new CategoryRule("dress", ClothingCategory.DRESSES,
            t -> t.itemType().contains("dress") || t.category().contains("dress")),
        new CategoryRule("tops", ClothingCategory.TOPS,
            t -> containsAny(t.category(), "top", "shirt", "blouse", "tee")),
        new CategoryRule("bottoms", ClothingCategory.BOTTOMS,
            t -> containsAny(t.category(), "bottom", "pant", "jean", "short", "skirt")),
        new CategoryRule("footwear", ClothingCategory.FOOTWEAR,
            t -> containsAny(t.category(), "shoe", "sneaker", "boot", "sandal", "heel", "footwear")),
        new CategoryRule("outerwear", ClothingCategory.OUTERWEAR,
            t -> containsAny(t.category(), "jacket", "coat", "blazer", "outer", "cardigan")),
        new CategoryRule("accessories", ClothingCategory.ACCESSORIES,
            t -> containsAny(t.category(), "accessory", "bag", "belt", "watch", "jewelry")),
        new CategoryRule("sportswear", ClothingCategory.SPORTSWEAR,
            t -> containsAny(t.category(), "sport", "gym", "athletic")),
        new CategoryRule("ethnic-category", ClothingCategory.ETHNIC,
            t -> containsAny(t.category(), "ethnic", "traditional")),
        new CategoryRule("formalwear", ClothingCategory.FORMALWEAR,
            t -> containsAny(t.category(), "formal", "suit"))
    );

    private static final ClothingCategory DEFAULT_CATEGORY = ClothingCategory.TOPS;

    public ClassifiedItem classify(WardrobeItem item) {
        if (item == null) {
            item = WardrobeItem.builder().build();
        }
        ClothingCategory category = categorize(item.getCategory(), item.getItemType());
        String subcategory = inferSubcategory(item.getName(), item.getItemType(), category);

        return ClassifiedItem.builder()
            .id(item.getId())
            .name(displayName(item))
            .category(category)
            .subcategory(subcategory)
            .silhouette(mapSilhouette(item.getFit()))
            .formality(mapFormality(item.getFormality(), category, subcategory))
            .season(mapSeason(item.getSeasons()))
            .aestheticTags(mapAesthetics(item.getStyleAesthetic()))
            .colorFamily(item.getColor() != null && !item.getColor().isBlank() ? item.getColor() : "unknown")
            .hasImage(item.hasImage())
            .source(item)
            .build();
    }

    public List<ClassifiedItem> classifyAll(List<WardrobeItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<ClassifiedItem> classified = items.stream().map(this::classify).toList();
        log.debug("Wardrobe classified | items={}", classified.size());
        return classified;
    }

    public List<CategoryRule> categoryRules() {
        return CATEGORY_RULES;
    }

    ClothingCategory categorize(String rawCategory, String itemType) {
        CategoryText text = new CategoryText(lower(rawCategory), lower(itemType));
        return CATEGORY_RULES.stream()
            .filter(rule -> rule.matches(text))
            .map(CategoryRule::category)
            .findFirst()
            .orElse(DEFAULT_CATEGORY);
    }

    String inferSubcategory(String name, String itemType, ClothingCategory category) {
        String searchText = lower(name) + " " + lower(itemType);
        for (String subcategory : category.subcategories()) {
            if (searchText.contains(subcategory) || searchText.contains(subcategory.replace('-', ' '))) {
                return subcategory;
            }
        }
        return category.defaultSubcategory();
    }

    Silhouette mapSilhouette(String fit) {
        String text = lower(fit);
        if (containsAny(text, "slim", "fitted", "tight")) {
            return Silhouette.SLIM;
        }
        if (containsAny(text, "relaxed", "loose")) {
            return Silhouette.RELAXED;
        }
        if (containsAny(text, "oversized", "baggy")) {
            return Silhouette.OVERSIZED;
        }
        if (text.contains("long")) {
            return Silhouette.LONGLINE;
        }
        return Silhouette.REGULAR;
    }

    FormalityLevel mapFormality(String formality, ClothingCategory category, String subcategory) {
        String text = lower(formality);
        if (text.contains("formal")) {
            return FormalityLevel.FORMAL;
        }
        // before the plain "smart" and "casual" checks
        if (text.contains("smart-casual") || text.contains("smart casual") || text.contains("business casual")) {
            return FormalityLevel.SMART_CASUAL;
        }
        if (text.contains("smart")) {
            return FormalityLevel.SMART;
        }
        if (text.contains("casual")) {
            return FormalityLevel.CASUAL;
        }

        if (category == ClothingCategory.FORMALWEAR) {
            return FormalityLevel.FORMAL;
        }
        if ("blazer".equals(subcategory) || "formal-shoes".equals(subcategory)) {
            return FormalityLevel.SMART;
        }
        if ("flip-flops".equals(subcategory) || "slides".equals(subcategory)
                || category == ClothingCategory.SPORTSWEAR) {
            return FormalityLevel.CASUAL;
        }
        return FormalityLevel.CASUAL;
    }

    SeasonType mapSeason(List<String> seasons) {
        if (seasons == null || seasons.isEmpty()) {
            return SeasonType.ALL_SEASON;
        }
        List<String> lowered = seasons.stream().filter(Objects::nonNull).map(ItemClassifierService::lower).toList();
        if (lowered.stream().anyMatch(s -> containsAny(s, "winter", "cold"))) {
            return SeasonType.COLD;
        }
        if (lowered.stream().anyMatch(s -> containsAny(s, "summer", "hot"))) {
            return SeasonType.HOT;
        }
        if (lowered.stream().anyMatch(s -> containsAny(s, "spring", "fall", "autumn"))) {
            return SeasonType.MILD;
        }
        return SeasonType.ALL_SEASON;
    }

    List<AestheticTag> mapAesthetics(List<String> aesthetics) {
        if (aesthetics == null) {
            return List.of();
        }
        return aesthetics.stream()
            .map(AestheticTag::fromCode)
            .filter(Objects::nonNull)
            .distinct()
            .toList();
    }

    private String displayName(WardrobeItem item) {
        if (item.getName() != null && !item.getName().isBlank()) {
            return item.getName();
        }
        String color = item.getColor() != null ? item.getColor() : "";
        String category = item.getCategory() != null ? item.getCategory() : "";
        return (color + " " + category).trim();
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase();
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    /** Lower-cased category and item-type text seen by the category cascade. */
    public record CategoryText(String category, String itemType) {}

    public record CategoryRule(String name, ClothingCategory category, Predicate<CategoryText> predicate) {
        public boolean matches(CategoryText text) {
            return predicate.test(text);
        }
    }
}
