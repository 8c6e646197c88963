package com.riskcompass.api.strategy;

import com.riskcompass.api.gap.GapAnalysisService;
import com.riskcompass.scoring.gap.Gap;
import com.riskcompass.scoring.strategy.StrategyMatrix;
import com.riskcompass.scoring.strategy.StrategyMatrixBuilder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Strategy Matrix Service - remediation roadmap built from the gap analysis.
 */
@Service
public class StrategyMatrixService {

    private final GapAnalysisService gapAnalysisService;
    private final StrategyMatrixBuilder strategyMatrixBuilder;

    public StrategyMatrixService(GapAnalysisService gapAnalysisService, StrategyMatrixBuilder strategyMatrixBuilder) {
        this.gapAnalysisService = gapAnalysisService;
        this.strategyMatrixBuilder = strategyMatrixBuilder;
    }

    @Transactional(readOnly = true)
    public StrategyMatrix getStrategyMatrix(UUID assessmentId, UUID organizationId) {
        List<Gap> gaps = gapAnalysisService.getGapAnalysis(assessmentId, organizationId);
        return strategyMatrixBuilder.buildMatrix(organizationId.toString(), assessmentId.toString(), gaps);
    }
}
