package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SoftRule {
    String id;
    SoftRuleType type;
    String condition;
    double weight;
    String explanation;
    PreferenceCategory category;
}
