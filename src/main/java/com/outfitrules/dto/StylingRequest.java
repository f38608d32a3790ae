package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StylingRequest {
    @Builder.Default
    List<WardrobeItem> wardrobe = List.of();
    @Builder.Default
    List<OutfitDraft> candidates = List.of();
    @Builder.Default
    RuleContext context = RuleContext.builder().build();
    @Builder.Default
    RuleConfig ruleConfig = RuleConfig.defaults();
    PreferenceSet preferences;
    @Builder.Default
    List<String> targetAesthetics = List.of();
    Integer topN;
}
