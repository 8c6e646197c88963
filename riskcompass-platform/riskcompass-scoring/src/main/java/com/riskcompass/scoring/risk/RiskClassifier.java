package com.riskcompass.scoring.risk;

import com.riskcompass.scoring.engine.EvidenceDistribution;
import com.riskcompass.scoring.evidence.ConfidenceLevel;

/**
 * Maps an overall score to a risk band and an evidence distribution to a confidence level.
 *
 * <p>Bands: [0,30) CRITICAL, [30,60) HIGH, [60,80) MEDIUM, [80,100] LOW. A score sitting exactly
 * on a boundary belongs to the higher band. Scores outside [0,100] are clamped first.
 */
public class RiskClassifier {

    public static final double HIGH_THRESHOLD = 30.0;
    public static final double MEDIUM_THRESHOLD = 60.0;
    public static final double LOW_THRESHOLD = 80.0;

    public static final double HIGH_CONFIDENCE_TIER2_PERCENT = 60.0;
    public static final double MEDIUM_CONFIDENCE_TIER2_PERCENT = 30.0;

    static final String CRITICAL_MESSAGE =
            "Critical compliance gaps detected. Immediate remediation is required before regulatory review.";
    static final String HIGH_MESSAGE =
            "Significant compliance weaknesses found. Prioritise remediation of foundational controls.";
    static final String MEDIUM_MESSAGE =
            "Moderate compliance posture. Address remaining gaps to reach a defensible position.";
    static final String LOW_MESSAGE =
            "Strong compliance posture. Maintain controls and keep evidence up to date.";

    public RiskClassification classifyRisk(double score) {
        double s = Double.isNaN(score) ? 0.0 : Math.max(0.0, Math.min(100.0, score));
        if (s < HIGH_THRESHOLD) {
            return new RiskClassification(RiskLevel.CRITICAL, CRITICAL_MESSAGE);
        }
        if (s < MEDIUM_THRESHOLD) {
            return new RiskClassification(RiskLevel.HIGH, HIGH_MESSAGE);
        }
        if (s < LOW_THRESHOLD) {
            return new RiskClassification(RiskLevel.MEDIUM, MEDIUM_MESSAGE);
        }
        return new RiskClassification(RiskLevel.LOW, LOW_MESSAGE);
    }

    /**
     * Confidence follows the share of document-extracted (tier 2) answers.
     */
    public ConfidenceLevel classifyConfidence(EvidenceDistribution distribution) {
        if (distribution == null) {
            return ConfidenceLevel.LOW;
        }
        double tier2 = distribution.tier2Percentage();
        if (tier2 >= HIGH_CONFIDENCE_TIER2_PERCENT) {
            return ConfidenceLevel.HIGH;
        }
        if (tier2 >= MEDIUM_CONFIDENCE_TIER2_PERCENT) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }
}
