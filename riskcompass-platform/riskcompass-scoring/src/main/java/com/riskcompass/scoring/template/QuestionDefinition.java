package com.riskcompass.scoring.template;

import com.riskcompass.scoring.rule.ScoringRule;

/**
 * Author-facing question definition.
 *
 * @param rawWeight relative importance before normalization; null means "not set"
 * @param scoringRule parsed rule, null when the stored rule could not be parsed
 */
public record QuestionDefinition(
        String id,
        String text,
        QuestionType type,
        Double rawWeight,
        boolean foundational,
        boolean required,
        ScoringRule scoringRule
) {

    public QuestionDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Question ID cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Question type cannot be null");
        }
    }

    /**
     * A raw weight above 1.0 marks a regulatorily critical question even without the explicit flag.
     */
    public boolean isFoundational() {
        return foundational || (rawWeight != null && rawWeight > 1.0);
    }

    /**
     * Weight used for normalization. Absent or negative weights count as zero.
     */
    public double effectiveRawWeight() {
        if (rawWeight == null || rawWeight.isNaN() || rawWeight < 0) {
            return 0.0;
        }
        return rawWeight;
    }
}
