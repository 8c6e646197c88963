package com.riskcompass.scoring.risk;

/**
 * Ordinal risk band. Higher compliance score means lower risk.
 */
public enum RiskLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
