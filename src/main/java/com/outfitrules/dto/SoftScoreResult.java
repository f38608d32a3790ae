package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SoftScoreResult {
    double score;
    List<String> matchedRules;
    List<String> violations;
}
