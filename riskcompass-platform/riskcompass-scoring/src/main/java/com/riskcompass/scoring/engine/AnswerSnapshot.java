package com.riskcompass.scoring.engine;

import com.riskcompass.scoring.evidence.EvidenceTier;
import com.riskcompass.scoring.rule.AnswerValue;

/**
 * Current answer to one question, as seen by the engine.
 *
 * @param value null when the question has no answer value yet
 * @param tier null means self-declared
 * @param confidence extraction confidence in [0, 1] for document-extracted answers, otherwise null
 */
public record AnswerSnapshot(
        String questionId,
        AnswerValue value,
        EvidenceTier tier,
        String sourceDocumentId,
        Double confidence
) {

    public AnswerSnapshot {
        if (questionId == null || questionId.isBlank()) {
            throw new IllegalArgumentException("Question ID cannot be null or blank");
        }
        tier = EvidenceTier.orDefault(tier);
    }

    public static AnswerSnapshot of(String questionId, AnswerValue value, EvidenceTier tier) {
        return new AnswerSnapshot(questionId, value, tier, null, null);
    }

    public boolean isAnswered() {
        return value != null;
    }
}
