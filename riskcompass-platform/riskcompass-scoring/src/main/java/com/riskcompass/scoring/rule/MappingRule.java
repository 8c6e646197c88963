package com.riskcompass.scoring.rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Explicit value-to-points table. Points are expressed on {@code scale} (5 in stock templates)
 * and rescaled to 0-100. Multi-valued answers score the average of their options.
 */
public record MappingRule(Map<String, Double> points, double scale) implements ScoringRule {

    public MappingRule {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("Mapping rule needs at least one option");
        }
        if (!(scale > 0)) {
            throw new IllegalArgumentException("Scale must be positive");
        }
        points = Map.copyOf(new LinkedHashMap<>(points));
    }

    @Override
    public double evaluate(AnswerValue value) throws RuleEvaluationException {
        List<String> keys = value.optionKeys();
        if (keys.isEmpty()) {
            throw new RuleEvaluationException("No option selected");
        }
        double total = 0.0;
        for (String key : keys) {
            total += lookup(key);
        }
        return ScoringRule.clamp(total / keys.size() / scale * MAX_SCORE);
    }

    private double lookup(String key) throws RuleEvaluationException {
        Double exact = points.get(key);
        if (exact != null) {
            return exact;
        }
        String wanted = key.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> entry : points.entrySet()) {
            if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return entry.getValue();
            }
        }
        throw new RuleEvaluationException("Option '" + key + "' is not mapped by this rule");
    }
}
