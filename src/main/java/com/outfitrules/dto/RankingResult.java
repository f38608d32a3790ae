package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked batch outcome. {@code ranked} holds the surviving evaluations best first,
 * {@code blocked} the rest in input order.
 */
@Value
@Builder
public class RankingResult {
    List<OutfitEvaluation> ranked;
    List<OutfitEvaluation> blocked;
    int passedCount;
    int blockedCount;
    int rescuedCount;
    int warningCount;
    boolean needsFallback;
    String fallbackReason;
    boolean relaxedRulesApplied;
    int topN;

    @JsonIgnore
    public List<OutfitEvaluation> getTop() {
        return ranked.subList(0, Math.min(topN, ranked.size()));
    }

    @JsonIgnore
    public List<OutfitDraft> getTopDrafts() {
        return getTop().stream().map(OutfitEvaluation::getDraft).toList();
    }
}
