package com.outfitrules.config;

import com.outfitrules.dto.HardRuleId;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Set;

/**
 * Tunable constants of the scoring, ranking and grounding stages.
 */
@Validated
@ConfigurationProperties(prefix = "styling")
public record StylingProperties(
    @Valid @DefaultValue Scoring scoring,
    @Valid @DefaultValue Ranking ranking,
    @Valid @DefaultValue Grounding grounding
) {

    public static StylingProperties defaults() {
        return new StylingProperties(
            new Scoring(0.3, 0.5, 0.3, 0.8),
            new Ranking(3, 0.5, 0.35, 0.15, 0.3,
                Set.of(HardRuleId.SILHOUETTE_MISMATCH, HardRuleId.FORMALITY_OCCASION_MISMATCH)),
            new Grounding(15, 4));
    }

    /**
     * Soft-rule token overlap scoring.
     *
     * @param matchThreshold         overlap fraction above which a rule counts as matched
     * @param avoidPenaltyMultiplier share of a matched avoid rule's weight that is subtracted
     * @param unmatchedPreferCredit  share of weight credited for an unmatched prefer rule
     * @param unmatchedAvoidCredit   share of weight credited for an avoid rule that was avoided
     */
    public record Scoring(
        @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("1.0") double matchThreshold,
        @DefaultValue("0.5") @DecimalMin("0.0") @DecimalMax("1.0") double avoidPenaltyMultiplier,
        @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("1.0") double unmatchedPreferCredit,
        @DefaultValue("0.8") @DecimalMin("0.0") @DecimalMax("1.0") double unmatchedAvoidCredit
    ) {}

    public record Ranking(
        @DefaultValue("3") @Min(1) int defaultTopN,
        @DefaultValue("0.5") @DecimalMin("0.0") double hardWeight,
        @DefaultValue("0.35") @DecimalMin("0.0") double softWeight,
        @DefaultValue("0.15") @DecimalMin("0.0") double aestheticWeight,
        @DefaultValue("0.3") @DecimalMin("0.0") @DecimalMax("1.0") double relaxationPenalty,
        @NotNull @DefaultValue({"silhouette_mismatch", "formality_occasion_mismatch"}) Set<HardRuleId> relaxableRules
    ) {}

    public record Grounding(
        @DefaultValue("15") @Min(0) int minMatchScore,
        @DefaultValue("4") @Min(1) int maxDisplayItems
    ) {}
}
