package com.riskcompass.scoring.strategy;

import com.riskcompass.scoring.gap.Priority;

/**
 * Roadmap timeframe. Short- and medium-term priorities share the middle bucket.
 */
public enum Timeline {
    IMMEDIATE("0-6 months"),
    MID_TERM("6-18 months"),
    LONG_TERM("18+ months");

    private final String label;

    Timeline(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Timeline forPriority(Priority priority) {
        if (priority == null) {
            return MID_TERM;
        }
        return switch (priority) {
            case IMMEDIATE -> IMMEDIATE;
            case SHORT_TERM, MEDIUM_TERM -> MID_TERM;
            case LONG_TERM -> LONG_TERM;
        };
    }
}
