package com.riskcompass.scoring.rule;

/**
 * Per-question scoring rule. Each variant evaluates an answer to a raw score in [0, 100].
 */
public sealed interface ScoringRule permits MappingRule, KeywordRule, CountBucketRule {

    double MAX_SCORE = 100.0;

    /**
     * @return raw question score in [0, 100], before any evidence multiplier
     * @throws RuleEvaluationException if the value cannot be scored by this rule
     */
    double evaluate(AnswerValue value) throws RuleEvaluationException;

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(MAX_SCORE, score));
    }
}
