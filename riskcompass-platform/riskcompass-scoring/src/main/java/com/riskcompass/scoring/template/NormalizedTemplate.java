package com.riskcompass.scoring.template;

import java.util.List;

/**
 * Engine-facing template: section weights validated, question weights summing to 1.0 per section.
 */
public record NormalizedTemplate(
        String id,
        String name,
        int version,
        List<NormalizedSection> sections
) {

    public NormalizedTemplate {
        sections = List.copyOf(sections);
    }

    public int questionCount() {
        return sections.stream().mapToInt(s -> s.questions().size()).sum();
    }
}
