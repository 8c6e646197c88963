package com.riskcompass.scoring.engine;

import java.util.List;
import java.util.Optional;

/**
 * Output of one scoring run. Derived state, recomputed in full on every run.
 *
 * @param overallScore 0-100, rounded to two decimals
 * @param unansweredRequired required questions without an answer
 */
public record ScoreResult(
        double overallScore,
        List<SectionScore> sectionBreakdown,
        EvidenceDistribution evidenceDistribution,
        int unansweredRequired
) {

    public ScoreResult {
        sectionBreakdown = List.copyOf(sectionBreakdown);
    }

    public Optional<QuestionScore> questionScore(String questionId) {
        return sectionBreakdown.stream()
                .flatMap(s -> s.questions().stream())
                .filter(q -> q.questionId().equals(questionId))
                .findFirst();
    }
}
