package com.outfitrules.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleContext {
    @Builder.Default
    ResponseMode responseMode = ResponseMode.VISUAL_OUTFIT;
    boolean hasWardrobeItems;
    Climate climate;
    FormalityLevel formality;
    String occasion;
}
