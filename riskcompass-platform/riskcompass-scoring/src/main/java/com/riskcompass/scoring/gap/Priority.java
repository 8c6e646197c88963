package com.riskcompass.scoring.gap;

/**
 * Remediation urgency, derived from the 1-10 priority score.
 */
public enum Priority {
    IMMEDIATE,
    SHORT_TERM,
    MEDIUM_TERM,
    LONG_TERM
}
