package com.riskcompass.scoring.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.riskcompass.scoring.evidence.EvidenceTier;

/**
 * Tier counts over answered questions. Unanswered questions are not counted.
 */
public record EvidenceDistribution(int tier0, int tier1, int tier2) {

    public static final EvidenceDistribution EMPTY = new EvidenceDistribution(0, 0, 0);

    public EvidenceDistribution {
        if (tier0 < 0 || tier1 < 0 || tier2 < 0) {
            throw new IllegalArgumentException("Tier counts cannot be negative");
        }
    }

    @JsonProperty("total")
    public int total() {
        return tier0 + tier1 + tier2;
    }

    public int count(EvidenceTier tier) {
        return switch (EvidenceTier.orDefault(tier)) {
            case TIER_0 -> tier0;
            case TIER_1 -> tier1;
            case TIER_2 -> tier2;
        };
    }

    /**
     * Share of answered questions backed by the given tier, 0-100. Zero when nothing is answered.
     */
    public double percentage(EvidenceTier tier) {
        int total = total();
        return total == 0 ? 0.0 : count(tier) * 100.0 / total;
    }

    @JsonProperty("tier0Percentage")
    public double tier0Percentage() {
        return percentage(EvidenceTier.TIER_0);
    }

    @JsonProperty("tier1Percentage")
    public double tier1Percentage() {
        return percentage(EvidenceTier.TIER_1);
    }

    @JsonProperty("tier2Percentage")
    public double tier2Percentage() {
        return percentage(EvidenceTier.TIER_2);
    }

    EvidenceDistribution plus(EvidenceTier tier) {
        return switch (EvidenceTier.orDefault(tier)) {
            case TIER_0 -> new EvidenceDistribution(tier0 + 1, tier1, tier2);
            case TIER_1 -> new EvidenceDistribution(tier0, tier1 + 1, tier2);
            case TIER_2 -> new EvidenceDistribution(tier0, tier1, tier2 + 1);
        };
    }
}
