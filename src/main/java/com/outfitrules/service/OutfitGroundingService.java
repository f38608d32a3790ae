package com.outfitrules.service;

import com.outfitrules.config.StylingProperties;
import com.outfitrules.dto.AestheticTag;
import com.outfitrules.dto.ClassifiedItem;
import com.outfitrules.dto.GroundedOutfit;
import com.outfitrules.dto.OutfitDraft;
import com.outfitrules.dto.OutfitItemLayer;
import com.outfitrules.dto.OutfitLayout;
import com.outfitrules.dto.SlotItem;
import com.outfitrules.dto.VisualOutfit;
import com.outfitrules.dto.VisualOutfitItem;
import com.outfitrules.dto.WardrobeItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the abstract slot hints of a ranked draft to concrete, image-bearing wardrobe
 * items and lays them out for display.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutfitGroundingService {

    private static final int NAME_MATCH_SCORE = 50;
    private static final int NAME_WORD_SCORE = 15;
    private static final int COLOR_SCORE = 25;
    private static final int CATEGORY_SCORE = 20;
    private static final int ITEM_TYPE_SCORE = 20;
    private static final int FABRIC_SCORE = 10;
    private static final int FIT_SCORE = 10;
    private static final int STYLE_TAG_SCORE = 8;
    private static final int MIN_NAME_WORD_LENGTH = 3;
    private static final String UNNAMED_KEY_PREFIX = "\u0000index:";

    private final StylingProperties properties;

    /**
     * Grounds one draft. Each call starts from an empty used-item set, so one wardrobe item
     * can appear in several outfits but only once per outfit.
     */
    public GroundedOutfit ground(OutfitDraft draft, List<ClassifiedItem> wardrobe) {
        if (draft == null) {
            return GroundedOutfit.builder().groundedHints(List.of()).ungroundedHints(List.of()).build();
        }
        List<ClassifiedItem> items = wardrobe == null ? List.of()
            : wardrobe.stream().filter(Objects::nonNull).toList();
        Set<String> usedIds = Set.of();
        List<VisualOutfitItem> resolved = new ArrayList<>();
        List<String> grounded = new ArrayList<>();
        List<String> ungrounded = new ArrayList<>();

        for (SlotItem slotItem : draft.getSlots().itemsInSlotOrder()) {
            if (!slotItem.hasHint() && !slotItem.hasItemId()) {
                continue;
            }
            String label = slotItem.hasHint() ? slotItem.getHint() : slotItem.getItemId();

            HintResolution resolution = slotItem.hasItemId()
                ? resolveItemId(slotItem.getItemId(), items, usedIds)
                : HintResolution.unresolved(usedIds);
            if (resolution.match() == null && slotItem.hasHint()) {
                resolution = resolveHint(slotItem.getHint(), items, usedIds);
            }
            usedIds = resolution.usedIds();

            if (resolution.match() == null) {
                ungrounded.add(label);
                continue;
            }
            grounded.add(label);
            ClassifiedItem match = resolution.match();
            resolved.add(VisualOutfitItem.builder()
                .id(match.getId())
                .name(match.getName())
                .imageUrl(match.getSource() != null ? match.getSource().getDisplayImageUrl() : null)
                .layer(layerOf(match))
                .build());
        }

        int total = grounded.size() + ungrounded.size();
        double percentage = total == 0 ? 0.0 : Math.round(grounded.size() * 1000.0 / total) / 10.0;

        VisualOutfit visual = null;
        if (!resolved.isEmpty()) {
            List<VisualOutfitItem> display = resolved.stream()
                .sorted(Comparator.comparingInt(item -> item.getLayer().priority()))
                .limit(properties.grounding().maxDisplayItems())
                .toList();
            visual = VisualOutfit.builder()
                .title(draft.getTitle())
                .layout(OutfitLayout.forItemCount(display.size()))
                .items(display)
                .whyItWorks(draft.getWhyItWorks())
                .occasion(draft.getOccasion())
                .vibe(draft.getVibe())
                .build();
        }

        log.debug("Draft grounded | draft={} | grounded={} | ungrounded={} | percentage={}",
            draft.getId(), grounded.size(), ungrounded.size(), percentage);

        return GroundedOutfit.builder()
            .draftId(draft.getId())
            .visualOutfit(visual)
            .groundedHints(List.copyOf(grounded))
            .ungroundedHints(List.copyOf(ungrounded))
            .groundingPercentage(percentage)
            .build();
    }

    /** Grounds each draft independently and keeps only the outfits with something to show. */
    public List<VisualOutfit> groundAll(List<OutfitDraft> drafts, List<ClassifiedItem> wardrobe) {
        if (drafts == null) {
            return List.of();
        }
        List<VisualOutfit> outfits = drafts.stream()
            .filter(Objects::nonNull)
            .map(draft -> ground(draft, wardrobe))
            .filter(GroundedOutfit::isRenderable)
            .map(GroundedOutfit::getVisualOutfit)
            .toList();
        if (outfits.size() < drafts.size()) {
            log.info("Ungroundable outfits dropped | drafts={} | kept={}", drafts.size(), outfits.size());
        }
        return outfits;
    }

    /**
     * Best unused, image-bearing match for a hint. The returned set adds the match's id, or its
     * list position when it has none; the given set is never modified.
     */
    public HintResolution resolveHint(String hint, List<ClassifiedItem> wardrobe, Set<String> usedIds) {
        Set<String> used = usedIds == null ? Set.of() : usedIds;
        if (hint == null || hint.isBlank() || wardrobe == null) {
            return HintResolution.unresolved(used);
        }
        ClassifiedItem best = null;
        int bestIndex = -1;
        int bestScore = 0;
        for (int i = 0; i < wardrobe.size(); i++) {
            ClassifiedItem item = wardrobe.get(i);
            if (item == null || !isCandidate(item, i, used)) {
                continue;
            }
            int score = similarity(hint, item);
            if (score > bestScore) {
                best = item;
                bestIndex = i;
                bestScore = score;
            }
        }
        if (best == null || bestScore < properties.grounding().minMatchScore()) {
            return HintResolution.unresolved(used);
        }
        return new HintResolution(best, bestScore, markUsed(used, best, bestIndex));
    }

    /** Similarity of a free-text hint to a wardrobe item; higher is closer. */
    public int similarity(String hint, ClassifiedItem item) {
        String text = lower(hint);
        WardrobeItem source = item.getSource();
        int score = 0;

        String name = lower(item.getName());
        if (!name.isEmpty() && text.contains(name)) {
            score += NAME_MATCH_SCORE;
        } else {
            for (String word : name.split("\\s+")) {
                if (word.length() >= MIN_NAME_WORD_LENGTH && text.contains(word)) {
                    score += NAME_WORD_SCORE;
                }
            }
        }

        String color = source != null ? firstPresent(source.getColor(), source.getPrimaryColor()) : item.getColorFamily();
        if (matches(text, color) && !"unknown".equalsIgnoreCase(color)) {
            score += COLOR_SCORE;
        }
        String category = source != null ? source.getCategory()
            : item.getCategory() != null ? item.getCategory().code() : null;
        if (matches(text, category)) {
            score += CATEGORY_SCORE;
        }
        String itemType = source != null ? source.getItemType() : item.getSubcategory();
        if (matches(text, itemType)) {
            score += ITEM_TYPE_SCORE;
        }
        if (source != null && matches(text, source.getFabric())) {
            score += FABRIC_SCORE;
        }
        if (source != null && matches(text, source.getFit())) {
            score += FIT_SCORE;
        }
        for (String tag : styleTags(item)) {
            if (matches(text, tag)) {
                score += STYLE_TAG_SCORE;
            }
        }
        return score;
    }

    /** Display layer from the canonical category, refined by subcategory. */
    public OutfitItemLayer layerOf(ClassifiedItem item) {
        String subcategory = lower(item.getSubcategory());
        String text = lower(item.getName()) + " "
            + lower(item.getSource() != null ? item.getSource().getItemType() : null);
        if (text.contains("jumpsuit") || text.contains("romper")) {
            return OutfitItemLayer.ONE_PIECE;
        }
        if (item.getCategory() == null) {
            return OutfitItemLayer.TOP;
        }
        return switch (item.getCategory()) {
            case TOPS, ETHNIC -> OutfitItemLayer.TOP;
            case BOTTOMS -> OutfitItemLayer.BOTTOM;
            case FOOTWEAR -> OutfitItemLayer.SHOES;
            case OUTERWEAR -> OutfitItemLayer.OUTER;
            case ACCESSORIES -> OutfitItemLayer.ACCESSORY;
            case DRESSES -> OutfitItemLayer.DRESS;
            case SPORTSWEAR -> subcategory.contains("pants") || subcategory.contains("shorts")
                ? OutfitItemLayer.BOTTOM : OutfitItemLayer.TOP;
            case FORMALWEAR -> {
                if (subcategory.contains("trousers")) {
                    yield OutfitItemLayer.BOTTOM;
                }
                if (subcategory.equals("suit") || subcategory.contains("blazer")) {
                    yield OutfitItemLayer.OUTER;
                }
                yield OutfitItemLayer.TOP;
            }
        };
    }

    private HintResolution resolveItemId(String itemId, List<ClassifiedItem> wardrobe, Set<String> usedIds) {
        for (int i = 0; i < wardrobe.size(); i++) {
            ClassifiedItem item = wardrobe.get(i);
            if (item != null && itemId.equals(item.getId()) && isCandidate(item, i, usedIds)) {
                return new HintResolution(item, Integer.MAX_VALUE, markUsed(usedIds, item, i));
            }
        }
        return HintResolution.unresolved(usedIds);
    }

    private boolean isCandidate(ClassifiedItem item, int index, Set<String> usedIds) {
        return item.isHasImage() && !usedIds.contains(exclusionKey(item, index));
    }

    private Set<String> markUsed(Set<String> usedIds, ClassifiedItem item, int index) {
        Set<String> next = new HashSet<>(usedIds);
        next.add(exclusionKey(item, index));
        return Collections.unmodifiableSet(next);
    }

    /** Items without an id are excluded by their position in the wardrobe list. */
    private static String exclusionKey(ClassifiedItem item, int index) {
        return item.getId() != null ? item.getId() : UNNAMED_KEY_PREFIX + index;
    }

    private List<String> styleTags(ClassifiedItem item) {
        if (item.getSource() != null && item.getSource().getStyleAesthetic() != null) {
            return item.getSource().getStyleAesthetic().stream().filter(Objects::nonNull).toList();
        }
        return item.getAestheticTags().stream().map(AestheticTag::code).toList();
    }

    private static boolean matches(String text, String value) {
        return value != null && !value.isBlank() && text.contains(value.toLowerCase());
    }

    private static String firstPresent(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase();
    }

    /**
     * Outcome of one hint lookup. {@code match} is {@code null} when nothing scored high
     * enough; {@code usedIds} is the exclusion set to pass to the next lookup.
     */
    public record HintResolution(ClassifiedItem match, int score, Set<String> usedIds) {
        static HintResolution unresolved(Set<String> usedIds) {
            return new HintResolution(null, 0, usedIds);
        }
    }
}
