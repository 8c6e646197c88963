package com.riskcompass.scoring.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record VendorRecommendation(
        String vendorId,
        String name,
        @JsonProperty("gapsCovered") int gapsCovered,
        List<String> coveredGapIds
) {

    public VendorRecommendation {
        coveredGapIds = List.copyOf(coveredGapIds);
    }
}
