package com.riskcompass.api.scoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riskcompass.api.template.TemplateDefinitionMapper;
import com.riskcompass.core.domain.Assessment;
import com.riskcompass.core.domain.Assessment.AssessmentStatus;
import com.riskcompass.core.repository.AssessmentAnswerRepository;
import com.riskcompass.core.repository.AssessmentRepository;
import com.riskcompass.scoring.engine.AnswerSnapshot;
import com.riskcompass.scoring.engine.EvidenceDistribution;
import com.riskcompass.scoring.engine.ScoreResult;
import com.riskcompass.scoring.engine.ScoringEngine;
import com.riskcompass.scoring.evidence.ConfidenceLevel;
import com.riskcompass.scoring.risk.RiskClassification;
import com.riskcompass.scoring.risk.RiskClassifier;
import com.riskcompass.scoring.template.NormalizedTemplate;
import com.riskcompass.scoring.template.WeightNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Assessment Scoring Service - computes the evidence-weighted score of an assessment.
 *
 * Scoring always runs from scratch over the current answers. For COMPLETED assessments the
 * result replaces the stored score snapshot.
 */
@Service
public class AssessmentScoringService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentScoringService.class);
    private static final TypeReference<List<Map<String, Object>>> BREAKDOWN_TYPE = new TypeReference<>() {};

    private final AssessmentRepository assessmentRepository;
    private final AssessmentAnswerRepository answerRepository;
    private final TemplateDefinitionMapper templateMapper;
    private final WeightNormalizer weightNormalizer;
    private final ScoringEngine scoringEngine;
    private final RiskClassifier riskClassifier;
    private final ObjectMapper objectMapper;

    public AssessmentScoringService(
            AssessmentRepository assessmentRepository,
            AssessmentAnswerRepository answerRepository,
            TemplateDefinitionMapper templateMapper,
            WeightNormalizer weightNormalizer,
            ScoringEngine scoringEngine,
            RiskClassifier riskClassifier,
            ObjectMapper objectMapper) {
        this.assessmentRepository = assessmentRepository;
        this.answerRepository = answerRepository;
        this.templateMapper = templateMapper;
        this.weightNormalizer = weightNormalizer;
        this.scoringEngine = scoringEngine;
        this.riskClassifier = riskClassifier;
        this.objectMapper = objectMapper;
    }

    /**
     * Computes the score, risk level and confidence of an assessment.
     *
     * @throws AssessmentNotFoundException if the assessment does not exist
     * @throws com.riskcompass.scoring.template.TemplateConfigurationException if the template's
     *         section weights do not sum to 1.0
     */
    @Transactional
    public AssessmentScore computeScore(UUID assessmentId) {
        if (assessmentId == null) {
            throw new IllegalArgumentException("Assessment ID cannot be null");
        }
        Assessment assessment = assessmentRepository.findById(assessmentId)
                .orElseThrow(() -> new AssessmentNotFoundException(assessmentId));

        ScoredAssessment scored = score(assessment);
        ScoreResult result = scored.result();
        RiskClassification risk = riskClassifier.classifyRisk(result.overallScore());
        ConfidenceLevel confidence = riskClassifier.classifyConfidence(result.evidenceDistribution());

        if (assessment.getStatus() == AssessmentStatus.COMPLETED) {
            EvidenceDistribution d = result.evidenceDistribution();
            assessment.recordScore(result.overallScore(), risk.level(), confidence,
                    objectMapper.convertValue(result.sectionBreakdown(), BREAKDOWN_TYPE),
                    d.tier0(), d.tier1(), d.tier2());
            assessmentRepository.save(assessment);
        }

        log.info("Assessment {} scored {} ({}, confidence {})",
                assessmentId, result.overallScore(), risk.level(), confidence);
        return new AssessmentScore(assessmentId, result.overallScore(), risk.level(), risk.message(),
                confidence, result.sectionBreakdown(), result.evidenceDistribution(), result.unansweredRequired());
    }

    /**
     * Scores an assessment on behalf of its owning organization.
     * Another organization's assessment is reported as not found.
     */
    @Transactional(readOnly = true)
    public ScoredAssessment scoreForOrganization(UUID assessmentId, UUID organizationId) {
        return score(findForOrganization(assessmentId, organizationId));
    }

    /**
     * Loads an assessment owned by the given organization without scoring it.
     * Another organization's assessment is reported as not found.
     */
    @Transactional(readOnly = true)
    public Assessment findForOrganization(UUID assessmentId, UUID organizationId) {
        if (assessmentId == null || organizationId == null) {
            throw new IllegalArgumentException("Assessment ID and organization ID are required");
        }
        return assessmentRepository.findByIdAndOrganizationId(assessmentId, organizationId)
                .orElseThrow(() -> new AssessmentNotFoundException(assessmentId));
    }

    /**
     * Scores an already loaded assessment over its current answers. Nothing is persisted.
     */
    @Transactional(readOnly = true)
    public ScoredAssessment score(Assessment assessment) {
        NormalizedTemplate template = weightNormalizer.normalize(templateMapper.toDefinition(assessment.getTemplate()));
        List<AnswerSnapshot> answers = answerRepository.findByAssessmentIdAndSupersededAtIsNull(assessment.getId())
                .stream()
                .map(AnswerSnapshots::from)
                .toList();
        return new ScoredAssessment(assessment, template, scoringEngine.score(answers, template));
    }

    // ==================== Inner Types ====================

    public record ScoredAssessment(Assessment assessment, NormalizedTemplate template, ScoreResult result) {}


    public static class AssessmentNotFoundException extends RuntimeException {
        public AssessmentNotFoundException(UUID assessmentId) {
            super("Assessment not found: " + assessmentId);
        }
    }
}
