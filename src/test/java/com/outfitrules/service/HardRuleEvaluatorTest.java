package com.outfitrules.service;

import com.outfitrules.dto.Climate;
import com.outfitrules.dto.FormalityLevel;
import com.outfitrules.dto.HardRuleId;
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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HardRuleEvaluatorTest {

    private final HardRuleEvaluator evaluator = new HardRuleEvaluator();

    private static SlotItem item(String hint) {
        return SlotItem.builder().hint(hint).build();
    }

    private static OutfitDraft draft(SlotItem upper, SlotItem lowerWear, SlotItem footwear) {
        return OutfitDraft.builder()
            .id("draft-1")
            .slots(OutfitSlots.builder().upperWear(upper).lowerWear(lowerWear).footwear(footwear).build())
            .build();
    }

    private static OutfitDraft basicDraft() {
        return draft(item("white t-shirt"), item("blue jeans"), item("white sneakers"));
    }

    private static RuleContext context() {
        return RuleContext.builder().build();
    }

    @Test
    void evaluate_completeCasualOutfitPasses() {
        var result = evaluator.evaluate(basicDraft(), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getViolations()).isEmpty();
        assertThat(result.getScorePenalty()).isZero();
    }

    @Test
    void evaluate_missingFootwearBlocksOnMandatorySlots() {
        var result = evaluator.evaluate(draft(item("shirt"), item("jeans"), null), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.hasViolation(HardRuleId.MANDATORY_SLOTS)).isTrue();
        var violation = result.getViolations().get(0);
        assertThat(violation.getSeverity()).isEqualTo(RuleSeverity.BLOCK);
        assertThat(violation.getSlotsInvolved()).containsExactly(OutfitSlot.FOOTWEAR);
    }

    @Test
    void evaluate_draftWithoutSlotsReportsEveryMandatorySlot() {
        var result = evaluator.evaluate(OutfitDraft.builder().id("empty").slots(null).build(),
            context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getViolations().get(0).getSlotsInvolved())
            .containsExactly(OutfitSlot.UPPER_WEAR, OutfitSlot.LOWER_WEAR, OutfitSlot.FOOTWEAR);
    }

    @Test
    void evaluate_dressCategoryWithFootwearNeedsNoLowerWear() {
        var dress = SlotItem.builder().hint("floral midi").category("dresses").build();

        var result = evaluator.evaluate(draft(dress, null, item("strappy heels")), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(evaluator.isComplete(draft(dress, null, item("strappy heels")))).isTrue();
    }

    @Test
    void evaluate_jumpsuitHintCountsAsOnePiece() {
        var result = evaluator.evaluate(draft(item("black jumpsuit"), null, item("loafers")),
            context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
    }

    @Test
    void evaluate_dressWithoutFootwearStillBlocked() {
        var result = evaluator.evaluate(draft(item("red dress"), null, null), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        assertThat(evaluator.missingSlots(draft(item("red dress"), null, null))).containsExactly(OutfitSlot.FOOTWEAR);
    }

    @Test
    void evaluate_formalTopWithFlipFlopsBlocked() {
        var upper = SlotItem.builder().hint("white oxford shirt").formality(FormalityLevel.FORMAL).build();
        var footwear = SlotItem.builder().hint("flip flops").subcategory("flip-flops").build();

        var result = evaluator.evaluate(draft(upper, item("chinos"), footwear), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.hasViolation(HardRuleId.FORMALITY_MISMATCH_FOOTWEAR)).isTrue();
    }

    @Test
    void evaluate_smartTopWithSlidesBlockedEvenWhenRelaxed() {
        var upper = SlotItem.builder().hint("blazer").formality(FormalityLevel.SMART).build();
        var footwear = SlotItem.builder().hint("slides").subcategory("slides").build();
        var relaxed = RuleConfig.defaults().relaxed(Set.of(HardRuleId.values()), 0.3);

        var result = evaluator.evaluate(draft(upper, item("trousers"), footwear), context(), relaxed);

        assertThat(result.isAllowed()).isFalse();
    }

    @Test
    void evaluate_formalOccasionWithTrackPantsBlocked() {
        var bottoms = SlotItem.builder().hint("grey track pants").subcategory("track-pants").build();
        var formalContext = RuleContext.builder().formality(FormalityLevel.FORMAL).build();

        var result = evaluator.evaluate(draft(item("shirt"), bottoms, item("loafers")), formalContext,
            RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.hasViolation(HardRuleId.FORMALITY_OCCASION_MISMATCH)).isTrue();
    }

    @Test
    void evaluate_formalityGapWarnsWithPenalty() {
        var upper = SlotItem.builder().hint("silk shirt").formality(FormalityLevel.FORMAL).build();
        var footwear = SlotItem.builder().hint("canvas sneakers").formality(FormalityLevel.CASUAL).build();

        var result = evaluator.evaluate(draft(upper, item("jeans"), footwear), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.hasViolation(HardRuleId.FORMALITY_GENERAL_MISMATCH)).isTrue();
        assertThat(result.getScorePenalty()).isEqualTo(0.2);
    }

    @Test
    void evaluate_adjacentFormalityLevelsAreCompatible() {
        var upper = SlotItem.builder().hint("oxford").formality(FormalityLevel.SMART).build();
        var footwear = SlotItem.builder().hint("loafers").formality(FormalityLevel.SMART_CASUAL).build();

        var result = evaluator.evaluate(draft(upper, item("chinos"), footwear), context(), RuleConfig.defaults());

        assertThat(result.getViolations()).isEmpty();
    }

    @Test
    void evaluate_ethnicTopWithGymShortsBlocked() {
        var upper = SlotItem.builder().hint("cotton kurta").category("ethnic").build();
        var bottoms = SlotItem.builder().hint("black shorts").subcategory("gym-shorts").build();

        var result = evaluator.evaluate(draft(upper, bottoms, item("sandals")), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.hasViolation(HardRuleId.ETHNIC_COHERENCE)).isTrue();
    }

    @Test
    void evaluate_ethnicCoherenceSkippedWhenDisabled() {
        var upper = SlotItem.builder().hint("cotton kurta").category("ethnic").build();
        var bottoms = SlotItem.builder().hint("black shorts").subcategory("gym-shorts").build();
        var config = RuleConfig.builder().enforceEthnicCoherence(false).build();

        var result = evaluator.evaluate(draft(upper, bottoms, item("sandals")), context(), config);

        assertThat(result.isAllowed()).isTrue();
    }

    @Test
    void evaluate_pufferInHotClimateWarnsButAllows() {
        var outfit = OutfitDraft.builder()
            .id("hot")
            .slots(OutfitSlots.builder()
                .upperWear(item("linen shirt"))
                .lowerWear(item("shorts"))
                .footwear(item("sandals"))
                .layering(item("black puffer jacket"))
                .build())
            .build();
        var hot = RuleContext.builder().climate(Climate.HOT).build();

        var result = evaluator.evaluate(outfit, hot, RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.hasViolation(HardRuleId.CLIMATE_HEAVY_LAYERING)).isTrue();
        assertThat(result.getScorePenalty()).isGreaterThan(0.0);
    }

    @Test
    void evaluate_summerTopInColdClimateWithoutLayeringWarns() {
        var upper = SlotItem.builder().hint("tank top").season(SeasonType.HOT).build();
        var cold = RuleContext.builder().climate(Climate.COLD).build();

        var result = evaluator.evaluate(draft(upper, item("jeans"), item("boots")), cold, RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.hasViolation(HardRuleId.CLIMATE_TOO_LIGHT)).isTrue();
        assertThat(result.getScorePenalty()).isEqualTo(0.1);
    }

    @Test
    void evaluate_sameItemIdInTwoSlotsBlocked() {
        var upper = SlotItem.builder().hint("shirt").itemId("item-1").build();
        var bottoms = SlotItem.builder().hint("jeans").itemId("item-1").build();

        var result = evaluator.evaluate(draft(upper, bottoms, item("sneakers")), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isFalse();
        var duplicate = result.getViolations().stream()
            .filter(v -> v.getRuleId() == HardRuleId.DUPLICATE_ITEMS)
            .findFirst()
            .orElseThrow();
        assertThat(duplicate.getSlotsInvolved()).containsExactlyInAnyOrder(OutfitSlot.UPPER_WEAR, OutfitSlot.LOWER_WEAR);
    }

    @Test
    void evaluate_duplicateAcrossAccessoriesBlocked() {
        var outfit = OutfitDraft.builder()
            .id("acc")
            .slots(OutfitSlots.builder()
                .upperWear(item("shirt"))
                .lowerWear(item("jeans"))
                .footwear(item("sneakers"))
                .accessories(List.of(
                    SlotItem.builder().hint("watch").itemId("acc-1").build(),
                    SlotItem.builder().hint("watch again").itemId("acc-1").build()))
                .build())
            .build();

        var result = evaluator.evaluate(outfit, context(), RuleConfig.defaults());

        assertThat(result.hasViolation(HardRuleId.DUPLICATE_ITEMS)).isTrue();
        assertThat(result.isAllowed()).isFalse();
    }

    @Test
    void evaluate_oversizedTopWithRelaxedBottomsWarnsByDefault() {
        var upper = SlotItem.builder().hint("oversized hoodie").silhouette(Silhouette.OVERSIZED).build();
        var bottoms = SlotItem.builder().hint("wide pants").silhouette(Silhouette.RELAXED).build();

        var result = evaluator.evaluate(draft(upper, bottoms, item("sneakers")), context(), RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getScorePenalty()).isEqualTo(0.15);
    }

    @Test
    void evaluate_silhouetteMismatchBlocksWhenStrict() {
        var upper = SlotItem.builder().hint("longline coat").silhouette(Silhouette.LONGLINE).build();
        var bottoms = SlotItem.builder().hint("baggy jeans").silhouette(Silhouette.OVERSIZED).build();
        var strict = RuleConfig.builder().strictness(Strictness.STRICT).build();

        var result = evaluator.evaluate(draft(upper, bottoms, item("boots")), context(), strict);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getScorePenalty()).isEqualTo(0.5);
    }

    @Test
    void evaluate_relaxedConfigDemotesRelaxableBlockToWarn() {
        var bottoms = SlotItem.builder().hint("track pants").subcategory("track-pants").build();
        var formalContext = RuleContext.builder().formality(FormalityLevel.FORMAL).build();
        var relaxed = RuleConfig.defaults().relaxed(Set.of(HardRuleId.FORMALITY_OCCASION_MISMATCH), 0.3);

        var result = evaluator.evaluate(draft(item("shirt"), bottoms, item("loafers")), formalContext, relaxed);

        assertThat(result.isAllowed()).isTrue();
        RuleViolation violation = result.getViolations().get(0);
        assertThat(violation.getSeverity()).isEqualTo(RuleSeverity.WARN);
        assertThat(violation.getPenalty()).isEqualTo(0.3);
    }

    @Test
    void evaluate_relaxedConfigNeverDemotesMandatorySlots() {
        var relaxed = RuleConfig.defaults().relaxed(Set.of(HardRuleId.MANDATORY_SLOTS), 0.3);

        var result = evaluator.evaluate(draft(item("shirt"), null, item("sneakers")), context(), relaxed);

        assertThat(result.isAllowed()).isFalse();
    }

    @Test
    void evaluate_emptySlotItemWarnsWhenWardrobeVisualMode() {
        var wardrobeContext = RuleContext.builder()
            .responseMode(ResponseMode.VISUAL_OUTFIT)
            .hasWardrobeItems(true)
            .build();
        var outfit = draft(item("shirt"), SlotItem.builder().build(), item("sneakers"));

        var result = evaluator.evaluate(outfit, wardrobeContext, RuleConfig.defaults());

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.hasViolation(HardRuleId.WARDROBE_LOWER_MISSING)).isTrue();
        assertThat(result.getScorePenalty()).isZero();
    }

    @Test
    void evaluate_isIdempotent() {
        var upper = SlotItem.builder().hint("oversized hoodie").silhouette(Silhouette.OVERSIZED).itemId("a").build();
        var bottoms = SlotItem.builder().hint("wide pants").silhouette(Silhouette.RELAXED).itemId("a").build();
        var outfit = draft(upper, bottoms, item("sneakers"));
        var hot = RuleContext.builder().climate(Climate.HOT).build();

        var first = evaluator.evaluate(outfit, hot, RuleConfig.defaults());
        var second = evaluator.evaluate(outfit, hot, RuleConfig.defaults());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void evaluate_nullDraftIsReportedNotThrown() {
        var result = evaluator.evaluate(null, null, null);

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.hasViolation(HardRuleId.MANDATORY_SLOTS)).isTrue();
    }
}
