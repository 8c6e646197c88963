package com.riskcompass.scoring.risk;

public record RiskClassification(RiskLevel level, String message) {
}
