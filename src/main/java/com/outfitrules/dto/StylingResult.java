package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StylingResult {
    List<VisualOutfit> outfits;
    StylingDiagnostics diagnostics;
    CoverageProfile coverage;
    RankingResult ranking;
}
