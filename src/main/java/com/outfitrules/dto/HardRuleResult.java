package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class HardRuleResult {
    boolean allowed;
    List<RuleViolation> violations;
    double scorePenalty;

    public boolean hasViolation(HardRuleId ruleId) {
        return violations.stream().anyMatch(v -> v.getRuleId() == ruleId);
    }
}
