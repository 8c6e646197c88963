package com.riskcompass.scoring.strategy;

/**
 * Rendered in place of items when a timeframe has no gaps.
 */
public record EmptyState(String title, String message) {

    public static final EmptyState NO_GAPS = new EmptyState("No gaps in this timeframe", "All requirements met");
}
