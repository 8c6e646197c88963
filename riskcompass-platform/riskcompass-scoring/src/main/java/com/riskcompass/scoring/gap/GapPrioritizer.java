package com.riskcompass.scoring.gap;

/**
 * Rates a below-threshold question on the 0-5 quality scale used by assessors.
 *
 * <pre>
 *   score5        = questionScore / 20
 *   priorityScore = clamp(round((5 - score5) * 2 + (foundational ? 2 : 0) + sectionWeight * 5), 1, 10)
 * </pre>
 */
public class GapPrioritizer {

    public GapPrioritization prioritize(double questionScore, boolean foundational, double sectionWeight) {
        double score5 = Math.max(0.0, Math.min(100.0, questionScore)) / 20.0;

        Severity severity = severity(score5);
        int priorityScore = priorityScore(score5, foundational, sectionWeight);
        EffortSize effort = effort(score5, foundational, sectionWeight);
        CostRange cost = cost(severity, effort, foundational, sectionWeight);
        return new GapPrioritization(severity, priorityScore, priority(priorityScore), effort, cost);
    }

    Severity severity(double score5) {
        if (score5 < 1.5) return Severity.CRITICAL;
        if (score5 < 2.5) return Severity.HIGH;
        if (score5 < 3.5) return Severity.MEDIUM;
        return Severity.LOW;
    }

    int priorityScore(double score5, boolean foundational, double sectionWeight) {
        double raw = (5.0 - score5) * 2.0 + (foundational ? 2.0 : 0.0) + sectionWeight * 5.0;
        return (int) Math.max(1, Math.min(10, Math.round(raw)));
    }

    Priority priority(int priorityScore) {
        if (priorityScore >= 9) return Priority.IMMEDIATE;
        if (priorityScore >= 6) return Priority.SHORT_TERM;
        if (priorityScore >= 3) return Priority.MEDIUM_TERM;
        return Priority.LONG_TERM;
    }

    EffortSize effort(double score5, boolean foundational, double sectionWeight) {
        if (sectionWeight > 0.25 && foundational && score5 < 2.0) {
            return EffortSize.LARGE;
        }
        if ((sectionWeight >= 0.15 && sectionWeight <= 0.25) || foundational) {
            return EffortSize.MEDIUM;
        }
        return EffortSize.SMALL;
    }

    CostRange cost(Severity severity, EffortSize effort, boolean foundational, double sectionWeight) {
        if (effort == EffortSize.LARGE && severity == Severity.CRITICAL) {
            return sectionWeight > 0.20 ? CostRange.OVER_250K : CostRange.RANGE_100K_250K;
        }
        if (effort == EffortSize.LARGE || (effort == EffortSize.MEDIUM && foundational)) {
            return CostRange.RANGE_50K_100K;
        }
        if (effort == EffortSize.MEDIUM || foundational) {
            return CostRange.RANGE_10K_50K;
        }
        return CostRange.UNDER_10K;
    }
}
