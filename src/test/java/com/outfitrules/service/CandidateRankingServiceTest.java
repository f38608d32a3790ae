package com.outfitrules.service;

import com.outfitrules.config.StylingProperties;
import com.outfitrules.dto.Climate;
import com.outfitrules.dto.FormalityLevel;
import com.outfitrules.dto.HardRuleId;
import com.outfitrules.dto.OutfitDraft;
import com.outfitrules.dto.OutfitEvaluation;
import com.outfitrules.dto.OutfitSlot;
import com.outfitrules.dto.OutfitSlots;
import com.outfitrules.dto.RuleConfig;
import com.outfitrules.dto.RuleContext;
import com.outfitrules.dto.SlotItem;
import com.outfitrules.exception.InvalidRankingRequestException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateRankingServiceTest {

    private final StylingProperties properties = StylingProperties.defaults();
    private final HardRuleEvaluator hardRuleEvaluator = new HardRuleEvaluator();
    private final CandidateRankingService rankingService =
        new CandidateRankingService(hardRuleEvaluator, new SoftRuleScorer(properties), properties);

    private static SlotItem item(String hint) {
        return SlotItem.builder().hint(hint).build();
    }

    private static OutfitDraft draft(String id, SlotItem upper, SlotItem lowerWear, SlotItem footwear) {
        return OutfitDraft.builder()
            .id(id)
            .slots(OutfitSlots.builder().upperWear(upper).lowerWear(lowerWear).footwear(footwear).build())
            .build();
    }

    private static OutfitDraft clean(String id) {
        return draft(id, item("white t-shirt"), item("blue jeans"), item("white sneakers"));
    }

    private static OutfitDraft trackPantsDraft(String id) {
        var bottoms = SlotItem.builder().hint("grey track pants").subcategory("track-pants").build();
        return draft(id, item("white t-shirt"), bottoms, item("white sneakers"));
    }

    private static OutfitDraft noFootwear(String id) {
        return draft(id, item("white t-shirt"), item("blue jeans"), null);
    }

    @Test
    void rank_equalScoresKeepInputOrder() {
        var drafts = List.of(clean("a"), clean("b"), clean("c"));

        var first = rankingService.rank(drafts, RuleContext.builder().build(), RuleConfig.defaults(), null, List.of(), 3);
        var second = rankingService.rank(drafts, RuleContext.builder().build(), RuleConfig.defaults(), null, List.of(), 3);

        assertThat(first.getRanked()).extracting(e -> e.getDraft().getId()).containsExactly("a", "b", "c");
        assertThat(second.getTopDrafts()).isEqualTo(first.getTopDrafts());
        assertThat(first.isRelaxedRulesApplied()).isFalse();
    }

    @Test
    void rank_penalizedDraftRanksBelowCleanDraft() {
        var formalTop = SlotItem.builder().hint("white t-shirt").formality(FormalityLevel.FORMAL).build();
        var casualShoes = SlotItem.builder().hint("white sneakers").formality(FormalityLevel.CASUAL).build();
        var penalized = draft("penalized", formalTop, item("blue jeans"), casualShoes);

        var result = rankingService.rank(List.of(penalized, clean("clean")), RuleContext.builder().build(),
            RuleConfig.defaults(), null, List.of(), 2);

        assertThat(result.getRanked()).extracting(e -> e.getDraft().getId()).containsExactly("clean", "penalized");
        assertThat(result.getWarningCount()).isEqualTo(1);
        assertThat(result.getRanked().get(0).getCombinedScore())
            .isGreaterThan(result.getRanked().get(1).getCombinedScore());
    }

    @Test
    void rank_partitionsBlockedDrafts() {
        var result = rankingService.rank(List.of(clean("ok"), noFootwear("broken")), RuleContext.builder().build(),
            RuleConfig.defaults(), null, List.of(), 1);

        assertThat(result.getPassedCount()).isEqualTo(1);
        assertThat(result.getBlockedCount()).isEqualTo(1);
        assertThat(result.getBlocked().get(0).getMissingSlots()).containsExactly(OutfitSlot.FOOTWEAR);
        assertThat(result.getBlocked().get(0).isComplete()).isFalse();
        assertThat(result.isNeedsFallback()).isFalse();
        assertThat(result.isRelaxedRulesApplied()).isFalse();
    }

    @Test
    void rank_relaxedPassRescuesRelaxableBlocks() {
        var formal = RuleContext.builder().formality(FormalityLevel.FORMAL).build();

        var result = rankingService.rank(List.of(trackPantsDraft("track"), clean("ok"), noFootwear("broken")),
            formal, RuleConfig.defaults(), null, List.of(), 3);

        assertThat(result.isRelaxedRulesApplied()).isTrue();
        assertThat(result.getRescuedCount()).isEqualTo(1);
        assertThat(result.getPassedCount()).isEqualTo(2);
        assertThat(result.getBlockedCount()).isEqualTo(1);
        assertThat(result.getBlocked().get(0).getDraft().getId()).isEqualTo("broken");

        OutfitEvaluation rescued = result.getRanked().stream()
            .filter(OutfitEvaluation::isRescuedByRelaxation)
            .findFirst()
            .orElseThrow();
        assertThat(rescued.getDraft().getId()).isEqualTo("track");
        assertThat(rescued.getHardRuleResult().getScorePenalty()).isEqualTo(0.3);
        assertThat(result.getRanked().get(0).getDraft().getId()).isEqualTo("ok");
    }

    @Test
    void rank_allBlockedNeedsFallback() {
        var result = rankingService.rank(List.of(noFootwear("a"), noFootwear("b")), RuleContext.builder().build(),
            RuleConfig.defaults(), null, List.of(), 3);

        assertThat(result.isNeedsFallback()).isTrue();
        assertThat(result.getFallbackReason()).isEqualTo("All candidates failed hard rules");
        assertThat(result.getRanked()).isEmpty();
        assertThat(result.getTopDrafts()).isEmpty();
        assertThat(result.getBlockedCount()).isEqualTo(2);
    }

    @Test
    void rank_emptyCandidatesNeedsFallback() {
        var result = rankingService.rank(null, null, null, null, null, null);

        assertThat(result.isNeedsFallback()).isTrue();
        assertThat(result.getTopN()).isEqualTo(3);
    }

    @Test
    void rank_topLimitsToRequestedCount() {
        var result = rankingService.rank(List.of(clean("a"), clean("b"), clean("c")), RuleContext.builder().build(),
            RuleConfig.defaults(), null, List.of(), 2);

        assertThat(result.getPassedCount()).isEqualTo(3);
        assertThat(result.getTopDrafts()).extracting(OutfitDraft::getId).containsExactly("a", "b");
    }

    @Test
    void rank_rejectsNonPositiveTopN() {
        assertThatThrownBy(() -> rankingService.rank(List.of(clean("a")), null, null, null, null, 0))
            .isInstanceOf(InvalidRankingRequestException.class)
            .hasMessageContaining("topN");
    }

    @Test
    void hasViableCandidates_checksStrictPass() {
        assertThat(rankingService.hasViableCandidates(List.of(noFootwear("a"), clean("b")), null, null)).isTrue();
        assertThat(rankingService.hasViableCandidates(List.of(noFootwear("a")), null, null)).isFalse();
        assertThat(rankingService.hasViableCandidates(null, null, null)).isFalse();
    }

    @Test
    void summarize_countsViolationsByRuleAndSlot() {
        var hot = RuleContext.builder().climate(Climate.HOT).build();
        var puffer = OutfitDraft.builder()
            .id("puffer")
            .slots(OutfitSlots.builder()
                .upperWear(item("tee"))
                .lowerWear(item("shorts"))
                .footwear(item("sandals"))
                .layering(item("puffer jacket"))
                .build())
            .build();

        var result = rankingService.rank(List.of(puffer, noFootwear("broken")), hot, RuleConfig.defaults(),
            null, List.of(), 1);
        List<OutfitEvaluation> all = new ArrayList<>(result.getRanked());
        all.addAll(result.getBlocked());

        var summary = rankingService.summarize(all);

        assertThat(summary.getByRule()).containsEntry(HardRuleId.CLIMATE_HEAVY_LAYERING, 1)
            .containsEntry(HardRuleId.MANDATORY_SLOTS, 1);
        assertThat(summary.getBySlot()).containsEntry(OutfitSlot.LAYERING, 1).containsEntry(OutfitSlot.FOOTWEAR, 1);
        assertThat(summary.getBlockingRules()).containsExactly(HardRuleId.MANDATORY_SLOTS);
    }
}
