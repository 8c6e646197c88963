package com.riskcompass.scoring.rule;

import java.util.List;

/**
 * Pluggable free-text scoring curve. Implementations return a raw score in [0, 100].
 */
@FunctionalInterface
public interface KeywordHeuristic {

    double score(String text, List<String> keywords, List<String> negativeKeywords);
}
