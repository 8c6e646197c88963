package com.riskcompass.scoring.gap;

public enum EffortSize {
    SMALL,
    MEDIUM,
    LARGE
}
