package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class OutfitEvaluation {
    int inputIndex;
    OutfitDraft draft;
    HardRuleResult hardRuleResult;
    SoftScoreResult softScore;
    double aestheticScore;
    double combinedScore;
    boolean complete;
    List<OutfitSlot> missingSlots;
    boolean rescuedByRelaxation;

    public boolean isAllowed() {
        return hardRuleResult.isAllowed();
    }
}
