package com.riskcompass.scoring.gap;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
