package com.outfitrules.service;

import com.outfitrules.dto.Climate;
import com.outfitrules.dto.FormalityLevel;
import com.outfitrules.dto.HardRuleId;
import com.outfitrules.dto.HardRuleResult;
import com.outfitrules.dto.OutfitDraft;
import com.outfitrules.dto.OutfitSlot;
import com.outfitrules.dto.OutfitSlots;
import com.outfitrules.dto.ResponseMode;
import com.outfitrules.dto.RuleConfig;
import com.outfitrules.dto.RuleContext;
import com.outfitrules.dto.RuleSeverity;
import com.outfitrules.dto.RuleViolation;
import com.outfitrules.dto.SeasonType;
import com.outfitrules.dto.Silhouette;
import com.outfitrules.dto.SlotItem;
import com.outfitrules.dto.Strictness;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic styling constraints for a single draft. Every rule runs; violations
 * accumulate and the draft is allowed only when none of them blocks.
 */
@Slf4j
@Service
public class HardRuleEvaluator {

    private static final Set<String> TOO_CASUAL_FOOTWEAR = Set.of("flip-flops", "slides", "sandals");
    private static final Set<String> SPORTS_BOTTOMS = Set.of("gym-shorts", "track-pants", "sports-shorts", "athletic-shorts");
    private static final Set<FormalityLevel> DRESSY_UPPER = EnumSet.of(FormalityLevel.FORMAL, FormalityLevel.SMART);
    private static final Set<Silhouette> LONG_UPPER = EnumSet.of(Silhouette.LONGLINE, Silhouette.OVERSIZED);
    private static final Set<Silhouette> LOOSE_LOWER = EnumSet.of(Silhouette.OVERSIZED, Silhouette.RELAXED);

    private static final double FORMALITY_MISMATCH_PENALTY = 0.2;
    private static final double SILHOUETTE_WARN_PENALTY = 0.15;
    private static final double SILHOUETTE_BLOCK_PENALTY = 0.5;
    private static final double HEAVY_LAYERING_PENALTY = 0.25;
    private static final double TOO_LIGHT_PENALTY = 0.1;

    public HardRuleResult evaluate(OutfitDraft draft, RuleContext context, RuleConfig config) {
        RuleContext ctx = context != null ? context : RuleContext.builder().build();
        RuleConfig cfg = config != null ? config : RuleConfig.defaults();
        OutfitSlots slots = draft != null ? draft.getSlots() : OutfitSlots.empty();

        List<RuleViolation> violations = new ArrayList<>();
        checkMandatorySlots(slots, cfg, violations);
        if (cfg.isEnforceFormality()) {
            checkFormalityCoherence(slots, ctx, cfg, violations);
        }
        if (cfg.isEnforceSilhouette()) {
            checkSilhouetteCompatibility(slots, cfg, violations);
        }
        if (cfg.isEnforceEthnicCoherence()) {
            checkEthnicCoherence(slots, cfg, violations);
        }
        if (cfg.isEnforceClimateSanity() && ctx.getClimate() != null) {
            checkClimateSanity(slots, ctx.getClimate(), cfg, violations);
        }
        checkDuplicateItems(slots, cfg, violations);
        if (ctx.getResponseMode() == ResponseMode.VISUAL_OUTFIT && ctx.isHasWardrobeItems()) {
            checkWardrobeAvailability(slots, cfg, violations);
        }

        boolean allowed = violations.stream().noneMatch(RuleViolation::isBlocking);
        double penalty = violations.stream().mapToDouble(RuleViolation::getPenalty).sum();

        if (log.isDebugEnabled()) {
            log.debug("Hard rules evaluated | draft={} | allowed={} | violations={} | penalty={} | strictness={}",
                draft != null ? draft.getId() : null, allowed,
                violations.stream().map(v -> v.getRuleId().code()).toList(), penalty, cfg.getStrictness());
        }

        return HardRuleResult.builder()
            .allowed(allowed)
            .violations(List.copyOf(violations))
            .scorePenalty(penalty)
            .build();
    }

    /** Dress or one-piece in the upper slot replaces upper and lower wear. */
    public boolean isOnePiece(OutfitSlots slots) {
        SlotItem upper = slots.getUpperWear();
        if (upper == null) {
            return false;
        }
        String category = lower(upper.getCategory());
        String hint = lower(upper.getHint());
        return category.equals("dresses") || category.equals("dress")
            || hint.contains("dress") || hint.contains("jumpsuit");
    }

    public List<OutfitSlot> missingSlots(OutfitDraft draft) {
        OutfitSlots slots = draft != null ? draft.getSlots() : OutfitSlots.empty();
        List<OutfitSlot> required = isOnePiece(slots) ? List.of(OutfitSlot.FOOTWEAR) : OutfitSlot.MANDATORY;
        return required.stream().filter(slot -> !slots.isFilled(slot)).toList();
    }

    public boolean isComplete(OutfitDraft draft) {
        return missingSlots(draft).isEmpty();
    }

    private void checkMandatorySlots(OutfitSlots slots, RuleConfig cfg, List<RuleViolation> out) {
        List<OutfitSlot> required = isOnePiece(slots) ? List.of(OutfitSlot.FOOTWEAR) : OutfitSlot.MANDATORY;
        List<OutfitSlot> missing = required.stream().filter(slot -> !slots.isFilled(slot)).toList();
        if (missing.isEmpty()) {
            return;
        }
        out.add(violation(HardRuleId.MANDATORY_SLOTS, true, 0.0, cfg,
            "Incomplete outfit: missing " + joinSlots(missing),
            isOnePiece(slots)
                ? "Outfit must have footwear with dress/one-piece"
                : "Outfit must have upper_wear, lower_wear, and footwear",
            missing));
    }

    private void checkFormalityCoherence(OutfitSlots slots, RuleContext ctx, RuleConfig cfg, List<RuleViolation> out) {
        SlotItem upper = slots.getUpperWear();
        SlotItem lowerWear = slots.getLowerWear();
        SlotItem footwear = slots.getFootwear();
        FormalityLevel upperFormality = upper != null ? upper.getFormality() : null;
        FormalityLevel footwearFormality = footwear != null ? footwear.getFormality() : null;
        String footwearSub = footwear != null ? lower(footwear.getSubcategory()) : "";

        if (upperFormality != null && DRESSY_UPPER.contains(upperFormality) && TOO_CASUAL_FOOTWEAR.contains(footwearSub)) {
            out.add(violation(HardRuleId.FORMALITY_MISMATCH_FOOTWEAR, true, 0.0, cfg,
                "Formal/smart top with flip-flops, slides or sandals is not allowed",
                "Upper: " + upperFormality.code() + ", Footwear: " + footwearSub,
                List.of(OutfitSlot.UPPER_WEAR, OutfitSlot.FOOTWEAR)));
        }

        if (ctx.getFormality() == FormalityLevel.FORMAL && lowerWear != null
                && isSportsBottom(lower(lowerWear.getSubcategory()))) {
            out.add(violation(HardRuleId.FORMALITY_OCCASION_MISMATCH, true, 0.0, cfg,
                "Sports bottoms are not appropriate for a formal occasion",
                "Occasion requires formal, bottoms: " + lower(lowerWear.getSubcategory()),
                List.of(OutfitSlot.LOWER_WEAR)));
        }

        if (upperFormality != null && footwearFormality != null && !upperFormality.isCompatibleWith(footwearFormality)) {
            out.add(violation(HardRuleId.FORMALITY_GENERAL_MISMATCH, false, FORMALITY_MISMATCH_PENALTY, cfg,
                "Formality levels don't match well",
                "Upper: " + upperFormality.code() + ", Footwear: " + footwearFormality.code(),
                List.of(OutfitSlot.UPPER_WEAR, OutfitSlot.FOOTWEAR)));
        }
    }

    private void checkSilhouetteCompatibility(OutfitSlots slots, RuleConfig cfg, List<RuleViolation> out) {
        Silhouette upper = slots.getUpperWear() != null ? slots.getUpperWear().getSilhouette() : null;
        Silhouette lowerSil = slots.getLowerWear() != null ? slots.getLowerWear().getSilhouette() : null;
        if (upper == null || lowerSil == null || !LONG_UPPER.contains(upper) || !LOOSE_LOWER.contains(lowerSil)) {
            return;
        }
        boolean strict = cfg.getStrictness() == Strictness.STRICT;
        out.add(violation(HardRuleId.SILHOUETTE_MISMATCH, strict,
            strict ? SILHOUETTE_BLOCK_PENALTY : SILHOUETTE_WARN_PENALTY, cfg,
            "Oversized/longline top with very relaxed bottoms may look unbalanced",
            "Upper: " + upper.code() + ", Lower: " + lowerSil.code(),
            List.of(OutfitSlot.UPPER_WEAR, OutfitSlot.LOWER_WEAR)));
    }

    private void checkEthnicCoherence(OutfitSlots slots, RuleConfig cfg, List<RuleViolation> out) {
        SlotItem upper = slots.getUpperWear();
        SlotItem lowerWear = slots.getLowerWear();
        if (upper == null || lowerWear == null) {
            return;
        }
        String upperHint = lower(upper.getHint());
        boolean ethnicUpper = lower(upper.getCategory()).equals("ethnic")
            || upperHint.contains("kurta") || upperHint.contains("sherwani");

        String lowerSub = lower(lowerWear.getSubcategory());
        String lowerHint = lower(lowerWear.getHint());
        boolean sportsLower = lowerSub.contains("gym") || lowerSub.contains("sport")
            || lower(lowerWear.getCategory()).equals("sportswear")
            || lowerHint.contains("gym short") || lowerHint.contains("track pant");

        if (ethnicUpper && sportsLower) {
            out.add(violation(HardRuleId.ETHNIC_COHERENCE, true, 0.0, cfg,
                "Ethnic wear (kurta, sherwani) cannot be paired with gym/sports bottoms",
                "Upper: ethnic, Lower: sports/gym",
                List.of(OutfitSlot.UPPER_WEAR, OutfitSlot.LOWER_WEAR)));
        }
    }

    private void checkClimateSanity(OutfitSlots slots, Climate climate, RuleConfig cfg, List<RuleViolation> out) {
        SlotItem layering = slots.getLayering();
        if (climate == Climate.HOT && layering != null) {
            String hint = lower(layering.getHint());
            boolean heavy = hint.contains("puffer") || hint.contains("heavy coat") || hint.contains("wool coat")
                || layering.getSeason() == SeasonType.COLD;
            if (heavy) {
                out.add(violation(HardRuleId.CLIMATE_HEAVY_LAYERING, false, HEAVY_LAYERING_PENALTY, cfg,
                    "Heavy layering not recommended for hot climate",
                    "Climate: hot, Layering: " + hint,
                    List.of(OutfitSlot.LAYERING)));
            }
        }

        SlotItem upper = slots.getUpperWear();
        if (climate == Climate.COLD && layering == null && upper != null && upper.getSeason() == SeasonType.HOT) {
            out.add(violation(HardRuleId.CLIMATE_TOO_LIGHT, false, TOO_LIGHT_PENALTY, cfg,
                "Consider adding layering for cold weather",
                "Climate: cold, Upper: summer item, No layering",
                List.of(OutfitSlot.UPPER_WEAR, OutfitSlot.LAYERING)));
        }
    }

    private void checkDuplicateItems(OutfitSlots slots, RuleConfig cfg, List<RuleViolation> out) {
        Map<String, OutfitSlot> firstSeen = new HashMap<>();
        Set<OutfitSlot> involved = EnumSet.noneOf(OutfitSlot.class);
        int total = 0;
        for (OutfitSlot slot : OutfitSlot.values()) {
            for (SlotItem item : itemsIn(slots, slot)) {
                if (!item.hasItemId()) {
                    continue;
                }
                total++;
                OutfitSlot previous = firstSeen.putIfAbsent(item.getItemId().trim(), slot);
                if (previous != null) {
                    involved.add(previous);
                    involved.add(slot);
                }
            }
        }
        if (!involved.isEmpty()) {
            out.add(violation(HardRuleId.DUPLICATE_ITEMS, true, 0.0, cfg,
                "Same item appears multiple times in outfit",
                total + " items, " + firstSeen.size() + " unique",
                List.copyOf(involved)));
        }
    }

    private void checkWardrobeAvailability(OutfitSlots slots, RuleConfig cfg, List<RuleViolation> out) {
        Map<OutfitSlot, HardRuleId> rules = Map.of(
            OutfitSlot.UPPER_WEAR, HardRuleId.WARDROBE_UPPER_MISSING,
            OutfitSlot.LOWER_WEAR, HardRuleId.WARDROBE_LOWER_MISSING,
            OutfitSlot.FOOTWEAR, HardRuleId.WARDROBE_FOOTWEAR_MISSING);
        for (OutfitSlot slot : OutfitSlot.MANDATORY) {
            SlotItem item = slots.get(slot);
            if (item != null && !item.hasHint() && !item.hasItemId()) {
                out.add(violation(rules.get(slot), false, 0.0, cfg,
                    slot.code() + " has no wardrobe reference", null, List.of(slot)));
            }
        }
    }

    private RuleViolation violation(HardRuleId rule, boolean blocking, double penalty, RuleConfig cfg,
                                    String message, String evidence, List<OutfitSlot> slots) {
        RuleSeverity severity = RuleSeverity.WARN;
        double appliedPenalty = penalty;
        if (blocking && cfg.demotes(rule)) {
            appliedPenalty = cfg.getRelaxationPenalty();
        } else if (blocking) {
            severity = RuleSeverity.BLOCK;
        }
        return RuleViolation.builder()
            .ruleId(rule)
            .severity(severity)
            .message(message)
            .slotsInvolved(slots)
            .evidence(evidence)
            .penalty(appliedPenalty)
            .build();
    }

    private List<SlotItem> itemsIn(OutfitSlots slots, OutfitSlot slot) {
        if (slot == OutfitSlot.ACCESSORIES) {
            return slots.getAccessories() == null ? List.of()
                : slots.getAccessories().stream().filter(Objects::nonNull).toList();
        }
        SlotItem item = slots.get(slot);
        return item == null ? List.of() : List.of(item);
    }

    private static boolean isSportsBottom(String subcategory) {
        return SPORTS_BOTTOMS.contains(subcategory)
            || subcategory.contains("gym") || subcategory.contains("sport") || subcategory.contains("track");
    }

    private static String joinSlots(List<OutfitSlot> slots) {
        return String.join(", ", slots.stream().map(OutfitSlot::code).toList());
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }
}
