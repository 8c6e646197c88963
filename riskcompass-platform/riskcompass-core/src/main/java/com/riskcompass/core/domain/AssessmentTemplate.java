package com.riskcompass.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Versioned compliance questionnaire.
 *
 * A template becomes immutable once published; changes go into a new version.
 * Section weights must sum to 1.0, which is checked at publication.
 */
@Entity
@Table(name = "assessment_templates",
        uniqueConstraints = @UniqueConstraint(columnNames = {"name", "version"}))
public class AssessmentTemplate {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int version;

    @Column(nullable = false)
    private boolean published;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "template", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<TemplateSection> sections = new ArrayList<>();

    @Version
    private Long lockVersion;

    protected AssessmentTemplate() {}

    private AssessmentTemplate(String name, int version) {
        this.id = UUID.randomUUID();
        this.name = name;
        this.version = version;
        this.published = false;
        this.createdAt = Instant.now();
    }

    public static AssessmentTemplate create(String name, int version) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name cannot be null or blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Template version must be positive");
        }
        return new AssessmentTemplate(name, version);
    }

    public TemplateSection addSection(String title, String category, double weight) {
        ensureEditable();
        TemplateSection section = TemplateSection.create(this, sections.size(), title, category, weight);
        sections.add(section);
        return section;
    }

    /**
     * Freezes the template. Callers validate section weights first.
     */
    public void markPublished() {
        ensureEditable();
        this.published = true;
        this.publishedAt = Instant.now();
    }

    void ensureEditable() {
        if (published) {
            throw new IllegalStateException("Template " + id + " is published and cannot be modified");
        }
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public int getVersion() { return version; }
    public boolean isPublished() { return published; }
    public Instant getPublishedAt() { return publishedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public List<TemplateSection> getSections() { return Collections.unmodifiableList(sections); }
    public Long getLockVersion() { return lockVersion; }
}
