package com.outfitrules.service;

import com.outfitrules.config.StylingProperties;
import com.outfitrules.dto.HardRuleId;
import com.outfitrules.dto.HardRuleResult;
import com.outfitrules.dto.OutfitDraft;
import com.outfitrules.dto.OutfitEvaluation;
import com.outfitrules.dto.OutfitSlot;
import com.outfitrules.dto.PreferenceSet;
import com.outfitrules.dto.RankingResult;
import com.outfitrules.dto.RuleConfig;
import com.outfitrules.dto.RuleContext;
import com.outfitrules.dto.RuleViolation;
import com.outfitrules.dto.SoftRule;
import com.outfitrules.dto.SoftScoreResult;
import com.outfitrules.dto.ViolationSummary;
import com.outfitrules.exception.InvalidRankingRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Filters candidate drafts through the hard rules, scores the survivors and orders them.
 * When fewer than {@code topN} drafts pass, blocked drafts are re-evaluated once with the
 * relaxable rules demoted to warnings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateRankingService {

    private final HardRuleEvaluator hardRuleEvaluator;
    private final SoftRuleScorer softRuleScorer;
    private final StylingProperties properties;

    public RankingResult rank(List<OutfitDraft> drafts,
                              RuleContext context,
                              RuleConfig config,
                              PreferenceSet preferences,
                              List<String> targetAesthetics,
                              Integer topN) {
        StylingProperties.Ranking ranking = properties.ranking();
        int limit = topN != null ? topN : ranking.defaultTopN();
        if (limit < 1) {
            throw new InvalidRankingRequestException("topN must be at least 1, got " + limit);
        }
        RuleConfig baseConfig = config != null ? config : RuleConfig.defaults();
        List<OutfitDraft> candidates = drafts == null ? List.of() : drafts;
        List<SoftRule> softRules = softRuleScorer.normalize(preferences);

        List<OutfitEvaluation> passed = new ArrayList<>();
        List<OutfitEvaluation> blocked = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            OutfitDraft draft = candidates.get(i);
            HardRuleResult hard = hardRuleEvaluator.evaluate(draft, context, baseConfig);
            OutfitEvaluation evaluation = score(i, draft, hard, softRules, targetAesthetics, false);
            if (hard.isAllowed()) {
                passed.add(evaluation);
            } else {
                blocked.add(evaluation);
            }
        }

        boolean relaxedApplied = false;
        int rescued = 0;
        if (passed.size() < limit && !blocked.isEmpty()) {
            relaxedApplied = true;
            RuleConfig relaxedConfig = baseConfig.relaxed(ranking.relaxableRules(), ranking.relaxationPenalty());
            List<OutfitEvaluation> stillBlocked = new ArrayList<>();
            for (OutfitEvaluation evaluation : blocked) {
                HardRuleResult hard = hardRuleEvaluator.evaluate(evaluation.getDraft(), context, relaxedConfig);
                if (hard.isAllowed()) {
                    passed.add(score(evaluation.getInputIndex(), evaluation.getDraft(), hard,
                        softRules, targetAesthetics, true));
                    rescued++;
                } else {
                    stillBlocked.add(evaluation);
                }
            }
            blocked = stillBlocked;
            log.info("Relaxation applied | rescued={} | stillBlocked={} | demotedRules={}",
                rescued, blocked.size(), ranking.relaxableRules());
        }

        passed.sort(Comparator.comparingDouble(OutfitEvaluation::getCombinedScore).reversed()
            .thenComparingInt(OutfitEvaluation::getInputIndex));

        int warnings = 0;
        for (OutfitEvaluation evaluation : passed) {
            for (RuleViolation violation : evaluation.getHardRuleResult().getViolations()) {
                warnings += switch (violation.getSeverity()) {
                    case WARN -> 1;
                    case BLOCK -> 0;
                };
            }
        }

        boolean needsFallback = passed.isEmpty();
        String fallbackReason = needsFallback ? "All candidates failed hard rules" : null;
        if (needsFallback) {
            log.warn("No viable candidates | candidates={} | blocked={}", candidates.size(), blocked.size());
        }

        log.info("Candidates ranked | candidates={} | passed={} | blocked={} | rescued={} | topN={}",
            candidates.size(), passed.size(), blocked.size(), rescued, limit);

        return RankingResult.builder()
            .ranked(List.copyOf(passed))
            .blocked(List.copyOf(blocked))
            .passedCount(passed.size())
            .blockedCount(blocked.size())
            .rescuedCount(rescued)
            .warningCount(warnings)
            .needsFallback(needsFallback)
            .fallbackReason(fallbackReason)
            .relaxedRulesApplied(relaxedApplied)
            .topN(limit)
            .build();
    }

    /** Whether at least one draft passes the hard rules without relaxation. */
    public boolean hasViableCandidates(List<OutfitDraft> drafts, RuleContext context, RuleConfig config) {
        if (drafts == null) {
            return false;
        }
        return drafts.stream().anyMatch(draft -> hardRuleEvaluator.evaluate(draft, context, config).isAllowed());
    }

    /**
     * Violation counts per rule and per slot across the given evaluations, plus the rules
     * that blocked at least one of them.
     */
    public ViolationSummary summarize(List<OutfitEvaluation> evaluations) {
        Map<HardRuleId, Integer> byRule = new EnumMap<>(HardRuleId.class);
        Map<OutfitSlot, Integer> bySlot = new EnumMap<>(OutfitSlot.class);
        Set<HardRuleId> blocking = new LinkedHashSet<>();
        if (evaluations != null) {
            evaluations.stream()
                .filter(Objects::nonNull)
                .flatMap(evaluation -> evaluation.getHardRuleResult().getViolations().stream())
                .forEach(violation -> {
                    byRule.merge(violation.getRuleId(), 1, Integer::sum);
                    if (violation.getSlotsInvolved() != null) {
                        violation.getSlotsInvolved().forEach(slot -> bySlot.merge(slot, 1, Integer::sum));
                    }
                    if (violation.isBlocking()) {
                        blocking.add(violation.getRuleId());
                    }
                });
        }
        return ViolationSummary.builder()
            .byRule(byRule)
            .bySlot(bySlot)
            .blockingRules(List.copyOf(blocking))
            .build();
    }

    private OutfitEvaluation score(int index,
                                   OutfitDraft draft,
                                   HardRuleResult hard,
                                   List<SoftRule> softRules,
                                   List<String> targetAesthetics,
                                   boolean rescued) {
        StylingProperties.Ranking ranking = properties.ranking();
        SoftScoreResult soft = softRuleScorer.score(softRuleScorer.describe(draft), softRules);
        double aesthetic = softRuleScorer.aestheticAlignment(draft, targetAesthetics);
        double hardComponent = clamp(1.0 - hard.getScorePenalty());
        double combined = ranking.hardWeight() * hardComponent
            + ranking.softWeight() * soft.getScore()
            + ranking.aestheticWeight() * aesthetic;

        return OutfitEvaluation.builder()
            .inputIndex(index)
            .draft(draft)
            .hardRuleResult(hard)
            .softScore(soft)
            .aestheticScore(aesthetic)
            .combinedScore(round(combined))
            .complete(hardRuleEvaluator.isComplete(draft))
            .missingSlots(hardRuleEvaluator.missingSlots(draft))
            .rescuedByRelaxation(rescued)
            .build();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
