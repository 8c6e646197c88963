package com.riskcompass.core.domain;

import com.riskcompass.scoring.template.QuestionType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "template_questions")
public class TemplateQuestion {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "section_id", nullable = false)
    private TemplateSection section;

    @Column(nullable = false)
    private int position;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String text;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QuestionType type;

    @Column(name = "raw_weight")
    private Double rawWeight;

    /** Cached at publication. */
    @Column(name = "normalized_weight")
    private Double normalizedWeight;

    @Column(name = "is_foundational", nullable = false)
    private boolean foundational;

    @Column(nullable = false)
    private boolean required;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "scoring_rules", columnDefinition = "jsonb")
    private Map<String, Object> scoringRules;

    protected TemplateQuestion() {}

    static TemplateQuestion create(TemplateSection section, int position, String text, QuestionType type,
                                   Double rawWeight, boolean foundational, boolean required,
                                   Map<String, Object> scoringRules) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question text cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Question type cannot be null");
        }
        TemplateQuestion question = new TemplateQuestion();
        question.id = UUID.randomUUID();
        question.section = section;
        question.position = position;
        question.text = text;
        question.type = type;
        question.rawWeight = rawWeight;
        question.foundational = foundational;
        question.required = required;
        question.scoringRules = scoringRules;
        return question;
    }

    public void cacheNormalizedWeight(double normalizedWeight) {
        this.normalizedWeight = normalizedWeight;
    }

    public UUID getId() { return id; }
    public TemplateSection getSection() { return section; }
    public int getPosition() { return position; }
    public String getText() { return text; }
    public QuestionType getType() { return type; }
    public Double getRawWeight() { return rawWeight; }
    public Double getNormalizedWeight() { return normalizedWeight; }
    public boolean isFoundational() { return foundational; }
    public boolean isRequired() { return required; }
    public Map<String, Object> getScoringRules() { return scoringRules; }
}
