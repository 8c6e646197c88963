package com.riskcompass.scoring.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EffortDistribution(
        @JsonProperty("SMALL") int small,
        @JsonProperty("MEDIUM") int medium,
        @JsonProperty("LARGE") int large
) {

    public static final EffortDistribution NONE = new EffortDistribution(0, 0, 0);
}
