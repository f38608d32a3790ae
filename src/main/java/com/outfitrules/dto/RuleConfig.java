package com.outfitrules.dto;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-rule enable flags and strictness. In a {@link Strictness#RELAXED} evaluation the
 * rules listed in {@code demotedRules} report their blocks as warnings; rules that are not
 * {@link HardRuleId#isRelaxable() relaxable} are never demoted.
 */
@Value
@Builder(toBuilder = true)
public class RuleConfig {
    @Builder.Default
    boolean enforceFormality = true;
    @Builder.Default
    boolean enforceSilhouette = true;
    @Builder.Default
    boolean enforceEthnicCoherence = true;
    @Builder.Default
    boolean enforceClimateSanity = true;
    @Builder.Default
    Strictness strictness = Strictness.NORMAL;
    @Builder.Default
    Set<HardRuleId> demotedRules = Set.of();
    @Builder.Default
    double relaxationPenalty = 0.0;

    public static RuleConfig defaults() {
        return RuleConfig.builder().build();
    }

    /** Same enable flags, relaxed strictness, the given rules demoted to warn. */
    public RuleConfig relaxed(Set<HardRuleId> demotable, double penalty) {
        Set<HardRuleId> demoted = demotable.isEmpty() ? Set.of() : EnumSet.copyOf(demotable);
        return toBuilder()
            .strictness(Strictness.RELAXED)
            .demotedRules(demoted)
            .relaxationPenalty(penalty)
            .build();
    }

    public boolean demotes(HardRuleId rule) {
        return strictness == Strictness.RELAXED && rule.isRelaxable() && demotedRules.contains(rule);
    }
}
