package com.riskcompass.scoring.rule;

import java.util.List;
import java.util.Locale;

/**
 * Default free-text curve: share of expected keywords present, minus a fixed deduction per
 * negative keyword. Without keywords, falls back to answer length as a completeness signal.
 */
public final class KeywordCoverageHeuristic implements KeywordHeuristic {

    static final double NEGATIVE_DEDUCTION = 20.0;

    @Override
    public double score(String text, List<String> keywords, List<String> negativeKeywords) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String haystack = text.toLowerCase(Locale.ROOT);

        double score;
        if (keywords.isEmpty()) {
            score = lengthScore(text.trim().length());
        } else {
            long matched = keywords.stream()
                    .filter(k -> haystack.contains(k.toLowerCase(Locale.ROOT)))
                    .count();
            score = (double) matched / keywords.size() * 100.0;
        }

        long negatives = negativeKeywords.stream()
                .filter(k -> haystack.contains(k.toLowerCase(Locale.ROOT)))
                .count();
        return ScoringRule.clamp(score - negatives * NEGATIVE_DEDUCTION);
    }

    private double lengthScore(int length) {
        if (length < 10) return 20.0;
        if (length < 50) return 40.0;
        if (length < 100) return 60.0;
        return 80.0;
    }
}
