package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ViolationSummary {
    Map<HardRuleId, Integer> byRule;
    Map<OutfitSlot, Integer> bySlot;
    List<HardRuleId> blockingRules;
}
