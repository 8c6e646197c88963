package com.riskcompass.api.scoring;

import com.riskcompass.scoring.engine.EvidenceDistribution;
import com.riskcompass.scoring.engine.SectionScore;
import com.riskcompass.scoring.evidence.ConfidenceLevel;
import com.riskcompass.scoring.risk.RiskLevel;

import java.util.List;
import java.util.UUID;

/**
 * Result of {@link AssessmentScoringService#computeScore(UUID)}.
 */
public record AssessmentScore(
        UUID assessmentId,
        double overallScore,
        RiskLevel riskLevel,
        String riskMessage,
        ConfidenceLevel confidenceLevel,
        List<SectionScore> sectionBreakdown,
        EvidenceDistribution evidenceDistribution,
        int unansweredRequired
) {
}
