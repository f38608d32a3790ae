package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleViolation {
    HardRuleId ruleId;
    RuleSeverity severity;
    String message;
    List<OutfitSlot> slotsInvolved;
    String evidence;
    double penalty;

    public boolean isBlocking() {
        return severity == RuleSeverity.BLOCK;
    }
}
