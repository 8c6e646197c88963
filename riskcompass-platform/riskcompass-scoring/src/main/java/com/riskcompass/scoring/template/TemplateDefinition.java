package com.riskcompass.scoring.template;

import java.util.List;

/**
 * Immutable snapshot of a questionnaire template as authored.
 */
public record TemplateDefinition(
        String id,
        String name,
        int version,
        List<SectionDefinition> sections
) {

    public TemplateDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Template ID cannot be null or blank");
        }
        sections = sections == null ? List.of() : List.copyOf(sections);
    }
}
