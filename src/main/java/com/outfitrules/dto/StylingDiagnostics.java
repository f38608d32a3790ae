package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StylingDiagnostics {
    int passedCount;
    int blockedCount;
    boolean needsFallback;
    String fallbackReason;
    String coverageWarning;
}
