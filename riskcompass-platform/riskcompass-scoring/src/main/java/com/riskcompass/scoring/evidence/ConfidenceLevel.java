package com.riskcompass.scoring.evidence;

/**
 * Qualitative confidence in a score, driven by how much of it rests on verified evidence.
 */
public enum ConfidenceLevel {
    LOW, MEDIUM, HIGH
}
