package com.riskcompass.core.domain;

import com.riskcompass.scoring.evidence.ConfidenceLevel;
import com.riskcompass.scoring.risk.RiskLevel;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One organization's run through a published template.
 *
 * The score columns are a snapshot: every scoring run overwrites all of them together.
 */
@Entity
@Table(name = "assessments", indexes = {
        @Index(name = "idx_assessments_org", columnList = "organization_id")
})
public class Assessment {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "organization_id", nullable = false)
    private UUID organizationId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private AssessmentTemplate template;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AssessmentStatus status;

    @Column(name = "overall_score")
    private Double overallScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level")
    private RiskLevel riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_level")
    private ConfidenceLevel confidenceLevel;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "section_breakdown", columnDefinition = "jsonb")
    private List<Map<String, Object>> sectionBreakdown;

    @Column(name = "tier0_count")
    private Integer tier0Count;

    @Column(name = "tier1_count")
    private Integer tier1Count;

    @Column(name = "tier2_count")
    private Integer tier2Count;

    @Column(name = "scored_at")
    private Instant scoredAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    private Long version;

    public enum AssessmentStatus {
        DRAFT,
        IN_PROGRESS,
        COMPLETED,
        FAILED
    }

    protected Assessment() {}

    public static Assessment create(UUID organizationId, AssessmentTemplate template) {
        if (organizationId == null) {
            throw new IllegalArgumentException("Organization ID cannot be null");
        }
        if (template == null) {
            throw new IllegalArgumentException("Template cannot be null");
        }
        if (!template.isPublished()) {
            throw new IllegalStateException("Assessments can only use published templates");
        }
        Assessment assessment = new Assessment();
        assessment.id = UUID.randomUUID();
        assessment.organizationId = organizationId;
        assessment.template = template;
        assessment.status = AssessmentStatus.DRAFT;
        assessment.createdAt = Instant.now();
        return assessment;
    }

    public void start() {
        if (status != AssessmentStatus.DRAFT) {
            throw new IllegalStateException("Can only start DRAFT assessments");
        }
        status = AssessmentStatus.IN_PROGRESS;
    }

    public void complete() {
        if (status != AssessmentStatus.IN_PROGRESS) {
            throw new IllegalStateException("Can only complete IN_PROGRESS assessments");
        }
        status = AssessmentStatus.COMPLETED;
        completedAt = Instant.now();
    }

    public void fail() {
        if (status == AssessmentStatus.COMPLETED) {
            throw new IllegalStateException("Cannot fail a completed assessment");
        }
        status = AssessmentStatus.FAILED;
    }

    /**
     * Replaces the whole score snapshot.
     */
    public void recordScore(double overallScore, RiskLevel riskLevel, ConfidenceLevel confidenceLevel,
                            List<Map<String, Object>> sectionBreakdown,
                            int tier0Count, int tier1Count, int tier2Count) {
        this.overallScore = overallScore;
        this.riskLevel = riskLevel;
        this.confidenceLevel = confidenceLevel;
        this.sectionBreakdown = sectionBreakdown;
        this.tier0Count = tier0Count;
        this.tier1Count = tier1Count;
        this.tier2Count = tier2Count;
        this.scoredAt = Instant.now();
    }

    public boolean belongsTo(UUID organizationId) {
        return this.organizationId.equals(organizationId);
    }

    public UUID getId() { return id; }
    public UUID getOrganizationId() { return organizationId; }
    public AssessmentTemplate getTemplate() { return template; }
    public AssessmentStatus getStatus() { return status; }
    public Double getOverallScore() { return overallScore; }
    public RiskLevel getRiskLevel() { return riskLevel; }
    public ConfidenceLevel getConfidenceLevel() { return confidenceLevel; }
    public List<Map<String, Object>> getSectionBreakdown() { return sectionBreakdown; }
    public Integer getTier0Count() { return tier0Count; }
    public Integer getTier1Count() { return tier1Count; }
    public Integer getTier2Count() { return tier2Count; }
    public Instant getScoredAt() { return scoredAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Long getVersion() { return version; }
}
