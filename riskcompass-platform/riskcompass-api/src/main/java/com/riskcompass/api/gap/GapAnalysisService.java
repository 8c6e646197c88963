package com.riskcompass.api.gap;

import com.riskcompass.api.scoring.AssessmentScoringService;
import com.riskcompass.api.scoring.AssessmentScoringService.ScoredAssessment;
import com.riskcompass.core.domain.Assessment;
import com.riskcompass.scoring.entitlement.EntitlementGate;
import com.riskcompass.scoring.gap.Gap;
import com.riskcompass.scoring.gap.GapAnalysisGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Gap Analysis Service - lists the compliance gaps of an assessment.
 *
 * Organizations without a paid plan receive restricted placeholder gaps; their assessments
 * are never scored.
 */
@Service
public class GapAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(GapAnalysisService.class);

    private final AssessmentScoringService scoringService;
    private final EntitlementGate entitlementGate;
    private final GapAnalysisGenerator gapAnalysisGenerator;

    public GapAnalysisService(
            AssessmentScoringService scoringService,
            EntitlementGate entitlementGate,
            GapAnalysisGenerator gapAnalysisGenerator) {
        this.scoringService = scoringService;
        this.entitlementGate = entitlementGate;
        this.gapAnalysisGenerator = gapAnalysisGenerator;
    }

    /**
     * @throws AssessmentScoringService.AssessmentNotFoundException if the assessment does not exist
     *         or belongs to another organization
     */
    @Transactional(readOnly = true)
    public List<Gap> getGapAnalysis(UUID assessmentId, UUID organizationId) {
        Assessment assessment = scoringService.findForOrganization(assessmentId, organizationId);

        List<Gap> gaps;
        if (!entitlementGate.shouldGenerateRealAnalysis(organizationId.toString())) {
            gaps = gapAnalysisGenerator.generateMockedGapAnalysis(assessmentId.toString());
        } else {
            ScoredAssessment scored = scoringService.score(assessment);
            gaps = gapAnalysisGenerator.generateRealGapAnalysis(
                    assessmentId.toString(), scored.template(), scored.result());
        }

        log.info("Gap analysis for assessment {}: {} gaps", assessmentId, gaps.size());
        return gaps;
    }
}
