package com.riskcompass.scoring.engine;

import java.util.List;

/**
 * @param score weighted sum of question scores, in [0, 100]
 */
public record SectionScore(
        String sectionId,
        String title,
        String category,
        double weight,
        double score,
        List<QuestionScore> questions
) {

    public SectionScore {
        questions = List.copyOf(questions);
    }
}
