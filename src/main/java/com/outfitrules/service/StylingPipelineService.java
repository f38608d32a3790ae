package com.outfitrules.service;

import com.outfitrules.dto.ClassifiedItem;
import com.outfitrules.dto.CoverageProfile;
import com.outfitrules.dto.RankingResult;
import com.outfitrules.dto.RuleContext;
import com.outfitrules.dto.StylingDiagnostics;
import com.outfitrules.dto.StylingRequest;
import com.outfitrules.dto.StylingResult;
import com.outfitrules.dto.VisualOutfit;
import com.outfitrules.exception.InvalidStylingRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * One styling request end to end: classify the wardrobe, profile its coverage, rank the
 * candidate drafts and ground the top ones into renderable outfits.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StylingPipelineService {

    private final ItemClassifierService itemClassifierService;
    private final WardrobeCoverageService wardrobeCoverageService;
    private final CandidateRankingService candidateRankingService;
    private final OutfitGroundingService outfitGroundingService;

    public StylingResult run(StylingRequest request) {
        if (request == null) {
            throw new InvalidStylingRequestException("Styling request is required");
        }
        List<ClassifiedItem> wardrobe = itemClassifierService.classifyAll(request.getWardrobe());
        CoverageProfile coverage = wardrobeCoverageService.profile(wardrobe);
        String coverageWarning = wardrobeCoverageService.coverageWarning(coverage);
        if (!coverageWarning.isEmpty()) {
            log.warn("Incomplete wardrobe coverage | items={} | missing={}",
                coverage.getTotalItems(), coverage.getMissingMandatorySlots());
        }

        RuleContext context = request.getContext() != null ? request.getContext() : RuleContext.builder().build();
        if (!wardrobe.isEmpty() && !context.isHasWardrobeItems()) {
            context = context.toBuilder().hasWardrobeItems(true).build();
        }

        RankingResult ranking = candidateRankingService.rank(
            request.getCandidates(),
            context,
            request.getRuleConfig(),
            request.getPreferences(),
            request.getTargetAesthetics(),
            request.getTopN());

        List<VisualOutfit> outfits = outfitGroundingService.groundAll(ranking.getTopDrafts(), wardrobe);

        log.info("Styling completed | wardrobeItems={} | candidates={} | passed={} | outfits={} | fallback={}",
            wardrobe.size(), ranking.getPassedCount() + ranking.getBlockedCount(),
            ranking.getPassedCount(), outfits.size(), ranking.isNeedsFallback());

        StylingDiagnostics diagnostics = StylingDiagnostics.builder()
            .passedCount(ranking.getPassedCount())
            .blockedCount(ranking.getBlockedCount())
            .needsFallback(ranking.isNeedsFallback())
            .fallbackReason(ranking.getFallbackReason())
            .coverageWarning(coverageWarning.isEmpty() ? null : coverageWarning)
            .build();

        return StylingResult.builder()
            .outfits(outfits)
            .diagnostics(diagnostics)
            .coverage(coverage)
            .ranking(ranking)
            .build();
    }
}
