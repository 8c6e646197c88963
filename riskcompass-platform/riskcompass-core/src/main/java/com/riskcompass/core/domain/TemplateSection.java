package com.riskcompass.core.domain;

import com.riskcompass.scoring.template.QuestionType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "template_sections")
public class TemplateSection {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", nullable = false)
    private AssessmentTemplate template;

    @Column(nullable = false)
    private int position;

    @NotNull
    @Column(nullable = false)
    private String title;

    @Column(name = "category")
    private String category;

    @Column(nullable = false)
    private double weight;

    @OneToMany(mappedBy = "section", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<TemplateQuestion> questions = new ArrayList<>();

    protected TemplateSection() {}

    static TemplateSection create(AssessmentTemplate template, int position, String title,
                                  String category, double weight) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Section title cannot be null or blank");
        }
        if (Double.isNaN(weight) || weight < 0) {
            throw new IllegalArgumentException("Section weight must be a non-negative number");
        }
        TemplateSection section = new TemplateSection();
        section.id = UUID.randomUUID();
        section.template = template;
        section.position = position;
        section.title = title;
        section.category = category;
        section.weight = weight;
        return section;
    }

    public TemplateQuestion addQuestion(String text, QuestionType type, Double rawWeight,
                                        boolean foundational, boolean required,
                                        Map<String, Object> scoringRules) {
        template.ensureEditable();
        TemplateQuestion question = TemplateQuestion.create(this, questions.size(), text, type,
                rawWeight, foundational, required, scoringRules);
        questions.add(question);
        return question;
    }

    public UUID getId() { return id; }
    public AssessmentTemplate getTemplate() { return template; }
    public int getPosition() { return position; }
    public String getTitle() { return title; }
    public String getCategory() { return category; }
    public double getWeight() { return weight; }
    public List<TemplateQuestion> getQuestions() { return Collections.unmodifiableList(questions); }
}
