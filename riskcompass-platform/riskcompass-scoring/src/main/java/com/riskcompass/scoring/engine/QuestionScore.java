package com.riskcompass.scoring.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.riskcompass.scoring.evidence.EvidenceTier;

/**
 * Score of a single question.
 *
 * @param rawScore rule output in [0, 100] before the evidence multiplier
 * @param finalScore rawScore times the evidence multiplier
 * @param note why the question scored zero, when it did for a reason other than the answer itself
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuestionScore(
        String questionId,
        double normalizedWeight,
        boolean answered,
        boolean foundational,
        double rawScore,
        EvidenceTier tier,
        double multiplier,
        double finalScore,
        String note
) {

    static QuestionScore unanswered(String questionId, double normalizedWeight, boolean foundational) {
        return new QuestionScore(questionId, normalizedWeight, false, foundational,
                0.0, null, 0.0, 0.0, "unanswered");
    }
}
