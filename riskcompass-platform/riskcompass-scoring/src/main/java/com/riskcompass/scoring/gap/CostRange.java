package com.riskcompass.scoring.gap;

/**
 * Estimated remediation cost band, in thousands of euros.
 * {@link #OVER_250K} has no upper bound.
 */
public enum CostRange {
    UNDER_10K(0, 10),
    RANGE_10K_50K(10, 50),
    RANGE_50K_100K(50, 100),
    RANGE_100K_250K(100, 250),
    OVER_250K(250, null);

    private final int lowK;
    private final Integer highK;

    CostRange(int lowK, Integer highK) {
        this.lowK = lowK;
        this.highK = highK;
    }

    public int lowK() {
        return lowK;
    }

    /**
     * @return upper bound in thousands, or null when open-ended
     */
    public Integer highK() {
        return highK;
    }

    public boolean isOpenEnded() {
        return highK == null;
    }
}
