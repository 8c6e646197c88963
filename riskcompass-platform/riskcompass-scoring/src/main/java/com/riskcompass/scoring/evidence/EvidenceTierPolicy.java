package com.riskcompass.scoring.evidence;

import java.util.Collection;

/**
 * Platform-wide evidentiary trust policy.
 * Multipliers are fixed and deliberately not configurable per template.
 */
public final class EvidenceTierPolicy {

    public static final double SELF_DECLARED_MULTIPLIER = 0.6;
    public static final double REFERENCED_MULTIPLIER = 0.8;
    public static final double DOCUMENT_EXTRACTED_MULTIPLIER = 1.0;

    public double multiplierFor(EvidenceTier tier) {
        return switch (EvidenceTier.orDefault(tier)) {
            case TIER_0 -> SELF_DECLARED_MULTIPLIER;
            case TIER_1 -> REFERENCED_MULTIPLIER;
            case TIER_2 -> DOCUMENT_EXTRACTED_MULTIPLIER;
        };
    }

    public ConfidenceLevel confidenceContributionFor(EvidenceTier tier) {
        return switch (EvidenceTier.orDefault(tier)) {
            case TIER_0 -> ConfidenceLevel.LOW;
            case TIER_1 -> ConfidenceLevel.MEDIUM;
            case TIER_2 -> ConfidenceLevel.HIGH;
        };
    }

    /**
     * Picks the strongest tier among the evidence linked to one answer.
     * An empty or null collection yields TIER_0.
     */
    public EvidenceTier bestTier(Collection<EvidenceTier> tiers) {
        EvidenceTier best = EvidenceTier.TIER_0;
        if (tiers == null) {
            return best;
        }
        for (EvidenceTier tier : tiers) {
            if (tier != null && tier.ordinal() > best.ordinal()) {
                best = tier;
            }
        }
        return best;
    }
}
