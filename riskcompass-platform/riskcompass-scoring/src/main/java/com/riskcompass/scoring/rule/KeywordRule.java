package com.riskcompass.scoring.rule;

import java.util.List;

/**
 * Free-text rule delegating to a {@link KeywordHeuristic}.
 */
public record KeywordRule(List<String> keywords, List<String> negativeKeywords, KeywordHeuristic heuristic)
        implements ScoringRule {

    public KeywordRule {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        negativeKeywords = negativeKeywords == null ? List.of() : List.copyOf(negativeKeywords);
        heuristic = heuristic == null ? new KeywordCoverageHeuristic() : heuristic;
    }

    public KeywordRule(List<String> keywords, List<String> negativeKeywords) {
        this(keywords, negativeKeywords, null);
    }

    @Override
    public double evaluate(AnswerValue value) throws RuleEvaluationException {
        if (value instanceof AnswerValue.Numeric) {
            throw new RuleEvaluationException("Keyword rule cannot score a numeric answer");
        }
        return ScoringRule.clamp(heuristic.score(value.asText(), keywords, negativeKeywords));
    }
}
