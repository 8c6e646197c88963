package com.riskcompass.scoring.template;

import java.util.List;

/**
 * Author-facing section definition; {@code weight} is the fraction of the overall score.
 */
public record SectionDefinition(
        String id,
        String title,
        String category,
        double weight,
        List<QuestionDefinition> questions
) {

    public SectionDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Section ID cannot be null or blank");
        }
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
