package com.outfitrules.service;

import com.outfitrules.config.StylingProperties;
import com.outfitrules.dto.AestheticTag;
import com.outfitrules.dto.OutfitDraft;
import com.outfitrules.dto.OutfitSlots;
import com.outfitrules.dto.PreferenceCategory;
import com.outfitrules.dto.PreferenceSet;
import com.outfitrules.dto.SlotItem;
import com.outfitrules.dto.SoftRule;
import com.outfitrules.dto.SoftRuleType;
import com.outfitrules.dto.SoftScoreResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Weighted preference scoring. Soft rules influence ranking only; they never block.
 */
@Service
@RequiredArgsConstructor
public class SoftRuleScorer {

    private static final Pattern NEGATION = Pattern.compile("\\b(avoid\\w*|\\w*n['’]t|cannot|not)\\b", Pattern.CASE_INSENSITIVE);
    private static final int MIN_TOKEN_LENGTH = 4;
    private static final double NEUTRAL_SCORE = 0.5;

    static final PreferenceSet DEFAULT_PREFERENCES = PreferenceSet.builder()
        .colorRules(List.of("neutral colors like black, white, grey, navy work with most items"))
        .silhouetteRules(List.of("balance fitted items with relaxed items for proportion"))
        .avoidPairs(List.of("clashing bright colors like red and orange together"))
        .coreDirections(List.of("complete looks with cohesive aesthetic"))
        .build();

    private final StylingProperties properties;

    /**
     * Normalizes preference statements into soft rules with their category's fixed weight.
     * A missing or empty preference set falls back to the built-in defaults.
     */
    public List<SoftRule> normalize(PreferenceSet preferences) {
        PreferenceSet source = preferences == null || preferences.isEmpty() ? DEFAULT_PREFERENCES : preferences;
        List<SoftRule> rules = new ArrayList<>();
        int counter = 0;
        for (PreferenceCategory category : PreferenceCategory.values()) {
            for (String statement : source.statements(category)) {
                if (statement == null || statement.isBlank()) {
                    continue;
                }
                rules.add(SoftRule.builder()
                    .id("soft_" + category.idPrefix() + "_" + counter++)
                    .type(ruleType(category, statement))
                    .condition(statement)
                    .weight(category.weight())
                    .explanation(category.explanation())
                    .category(category)
                    .build());
            }
        }
        return List.copyOf(rules);
    }

    public SoftScoreResult score(String outfitDescription, List<SoftRule> rules) {
        if (rules == null || rules.isEmpty()) {
            return SoftScoreResult.builder().score(NEUTRAL_SCORE).matchedRules(List.of()).violations(List.of()).build();
        }
        StylingProperties.Scoring scoring = properties.scoring();
        String outfit = outfitDescription == null ? "" : outfitDescription.toLowerCase();
        double totalWeight = 0.0;
        double earnedWeight = 0.0;
        List<String> matched = new ArrayList<>();
        List<String> violations = new ArrayList<>();

        for (SoftRule rule : rules) {
            totalWeight += rule.getWeight();
            double overlap = tokenOverlap(rule.getCondition(), outfit);
            boolean prefer = rule.getType() == SoftRuleType.PREFER;

            if (overlap > scoring.matchThreshold()) {
                if (prefer) {
                    earnedWeight += rule.getWeight() * overlap;
                    matched.add(rule.getId());
                } else {
                    earnedWeight -= rule.getWeight() * overlap * scoring.avoidPenaltyMultiplier();
                    violations.add(rule.getId());
                }
            } else if (prefer) {
                earnedWeight += rule.getWeight() * scoring.unmatchedPreferCredit();
            } else {
                earnedWeight += rule.getWeight() * scoring.unmatchedAvoidCredit();
            }
        }

        double score = totalWeight > 0 ? clamp(earnedWeight / totalWeight) : NEUTRAL_SCORE;
        return SoftScoreResult.builder()
            .score(score)
            .matchedRules(List.copyOf(matched))
            .violations(List.copyOf(violations))
            .build();
    }

    /**
     * Lower-cased text the soft rules are matched against: slot hints with the upper and
     * lower colour families and the upper silhouette, then vibe and occasion.
     */
    public String describe(OutfitDraft draft) {
        if (draft == null) {
            return "";
        }
        OutfitSlots slots = draft.getSlots();
        List<String> parts = new ArrayList<>();
        SlotItem upper = slots.getUpperWear();
        if (upper != null) {
            parts.add(upper.getHint());
            parts.add(upper.getColorFamily());
            parts.add(upper.getSilhouette() != null ? upper.getSilhouette().code() : null);
        }
        SlotItem lowerWear = slots.getLowerWear();
        if (lowerWear != null) {
            parts.add(lowerWear.getHint());
            parts.add(lowerWear.getColorFamily());
        }
        if (slots.getFootwear() != null) {
            parts.add(slots.getFootwear().getHint());
        }
        if (slots.getLayering() != null) {
            parts.add(slots.getLayering().getHint());
        }
        if (slots.getAccessories() != null) {
            slots.getAccessories().stream().filter(Objects::nonNull).forEach(acc -> parts.add(acc.getHint()));
        }
        parts.add(draft.getVibe());
        parts.add(draft.getOccasion());

        return parts.stream()
            .filter(p -> p != null && !p.isBlank())
            .collect(Collectors.joining(" "))
            .toLowerCase();
    }

    /**
     * Share of target aesthetics the outfit expresses: a literal mention counts 1, a
     * keyword of that aesthetic counts 0.5. Neutral 0.5 without targets.
     */
    public double aestheticAlignment(List<String> outfitItems, List<String> targetAesthetics) {
        List<String> targets = targetAesthetics == null ? List.of()
            : targetAesthetics.stream().filter(t -> t != null && !t.isBlank()).toList();
        if (targets.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        String outfitText = outfitItems == null ? ""
            : outfitItems.stream().filter(Objects::nonNull).collect(Collectors.joining(" ")).toLowerCase();

        double matches = 0.0;
        for (String target : targets) {
            String aesthetic = target.trim().toLowerCase();
            if (outfitText.contains(aesthetic)) {
                matches += 1.0;
                continue;
            }
            AestheticTag tag = AestheticTag.fromCode(aesthetic);
            if (tag != null && tag.keywords().stream().anyMatch(outfitText::contains)) {
                matches += 0.5;
            }
        }
        return Math.min(1.0, matches / targets.size());
    }

    public double aestheticAlignment(OutfitDraft draft, List<String> targetAesthetics) {
        return aestheticAlignment(List.of(describe(draft)), targetAesthetics);
    }

    private SoftRuleType ruleType(PreferenceCategory category, String statement) {
        if (category == PreferenceCategory.COLOR_RULES && NEGATION.matcher(statement).find()) {
            return SoftRuleType.AVOID;
        }
        return category.defaultType();
    }

    private double tokenOverlap(String condition, String outfit) {
        if (condition == null) {
            return 0.0;
        }
        List<String> tokens = Arrays.stream(condition.toLowerCase().split("\\s+"))
            .filter(token -> token.length() >= MIN_TOKEN_LENGTH)
            .toList();
        if (tokens.isEmpty()) {
            return 0.0;
        }
        long present = tokens.stream().filter(outfit::contains).count();
        return (double) present / tokens.size();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
