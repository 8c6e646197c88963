package com.riskcompass.core.domain;

import com.riskcompass.scoring.evidence.EvidenceTier;
import com.riskcompass.scoring.evidence.EvidenceTierPolicy;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Answer to one question of an assessment.
 *
 * Edits never update an answer in place: the previous row is marked superseded and a new one
 * is inserted, so only rows with a null {@code supersededAt} are current.
 * Exactly one of the value columns is set.
 */
@Entity
@Table(name = "assessment_answers", indexes = {
        @Index(name = "idx_answers_assessment_current", columnList = "assessment_id, superseded_at")
})
public class AssessmentAnswer {

    private static final EvidenceTierPolicy EVIDENCE_POLICY = new EvidenceTierPolicy();

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "assessment_id", nullable = false)
    private UUID assessmentId;

    @NotNull
    @Column(name = "question_id", nullable = false)
    private UUID questionId;

    @Column(name = "text_value", columnDefinition = "TEXT")
    private String textValue;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "selected_options", columnDefinition = "jsonb")
    private List<String> selectedOptions;

    @Column(name = "numeric_value")
    private Double numericValue;

    @Column(name = "boolean_value")
    private Boolean booleanValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "evidence_tier")
    private EvidenceTier evidenceTier;

    @Column(name = "source_document_id")
    private String sourceDocumentId;

    /** Extraction confidence, 0-1. */
    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "answered_at", nullable = false, updatable = false)
    private Instant answeredAt;

    @Column(name = "superseded_at")
    private Instant supersededAt;

    protected AssessmentAnswer() {}

    private static AssessmentAnswer base(UUID assessmentId, UUID questionId) {
        if (assessmentId == null) {
            throw new IllegalArgumentException("Assessment ID cannot be null");
        }
        if (questionId == null) {
            throw new IllegalArgumentException("Question ID cannot be null");
        }
        AssessmentAnswer answer = new AssessmentAnswer();
        answer.id = UUID.randomUUID();
        answer.assessmentId = assessmentId;
        answer.questionId = questionId;
        answer.evidenceTier = EvidenceTier.TIER_0;
        answer.answeredAt = Instant.now();
        return answer;
    }

    public static AssessmentAnswer text(UUID assessmentId, UUID questionId, String text) {
        AssessmentAnswer answer = base(assessmentId, questionId);
        answer.textValue = text;
        return answer;
    }

    public static AssessmentAnswer options(UUID assessmentId, UUID questionId, List<String> options) {
        AssessmentAnswer answer = base(assessmentId, questionId);
        answer.selectedOptions = options == null ? List.of() : List.copyOf(options);
        return answer;
    }

    public static AssessmentAnswer numeric(UUID assessmentId, UUID questionId, double value) {
        AssessmentAnswer answer = base(assessmentId, questionId);
        answer.numericValue = value;
        return answer;
    }

    public static AssessmentAnswer yesNo(UUID assessmentId, UUID questionId, boolean value) {
        AssessmentAnswer answer = base(assessmentId, questionId);
        answer.booleanValue = value;
        return answer;
    }

    /**
     * Records the evidence backing this answer.
     */
    public AssessmentAnswer withEvidence(EvidenceTier tier, String sourceDocumentId, Double confidence) {
        requireValidConfidence(confidence);
        this.evidenceTier = EvidenceTier.orDefault(tier);
        this.sourceDocumentId = sourceDocumentId;
        this.confidence = confidence;
        return this;
    }

    /**
     * Links one more evidence document to this answer. The answer keeps the strongest tier;
     * document and confidence follow the evidence that set it, earlier evidence winning ties.
     */
    public AssessmentAnswer linkEvidence(EvidenceTier tier, String sourceDocumentId, Double confidence) {
        requireValidConfidence(confidence);
        EvidenceTier current = EvidenceTier.orDefault(evidenceTier);
        EvidenceTier incoming = EvidenceTier.orDefault(tier);
        if (incoming != current && EVIDENCE_POLICY.bestTier(List.of(current, incoming)) == incoming) {
            withEvidence(incoming, sourceDocumentId, confidence);
        }
        return this;
    }

    private static void requireValidConfidence(Double confidence) {
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1");
        }
    }

    public void supersede() {
        if (supersededAt != null) {
            throw new IllegalStateException("Answer " + id + " is already superseded");
        }
        supersededAt = Instant.now();
    }

    public boolean isCurrent() {
        return supersededAt == null;
    }

    public UUID getId() { return id; }
    public UUID getAssessmentId() { return assessmentId; }
    public UUID getQuestionId() { return questionId; }
    public String getTextValue() { return textValue; }
    public List<String> getSelectedOptions() { return selectedOptions; }
    public Double getNumericValue() { return numericValue; }
    public Boolean getBooleanValue() { return booleanValue; }
    public EvidenceTier getEvidenceTier() { return evidenceTier; }
    public String getSourceDocumentId() { return sourceDocumentId; }
    public Double getConfidence() { return confidence; }
    public Instant getAnsweredAt() { return answeredAt; }
    public Instant getSupersededAt() { return supersededAt; }
}
