package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CategoryCoverage {
    int count;
    int withImages;
    CoverageLevel level;

    public static CategoryCoverage of(int count, int withImages) {
        return new CategoryCoverage(count, withImages, CoverageLevel.fromCount(count));
    }
}
