package com.riskcompass.scoring.evidence;

/**
 * How the truth of an answer was substantiated.
 */
public enum EvidenceTier {
    /** Self-declared, no supporting evidence. */
    TIER_0,
    /** Evidence referenced or claimed, not machine-verified. */
    TIER_1,
    /** Value extracted directly from an uploaded authoritative document. */
    TIER_2;

    /**
     * Answers without a tier designation are treated as self-declared.
     */
    public static EvidenceTier orDefault(EvidenceTier tier) {
        return tier != null ? tier : TIER_0;
    }
}
