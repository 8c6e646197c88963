package com.riskcompass.scoring.strategy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One roadmap column.
 *
 * @param emptyState set only when the bucket has no gaps
 */
public record TimelineBucket(
        Timeline timeline,
        @JsonProperty("gapCount") int gapCount,
        @JsonProperty("effortDistribution") EffortDistribution effortDistribution,
        @JsonProperty("estimatedCostRange") String estimatedCostRange,
        @JsonProperty("topVendors") List<VendorRecommendation> topVendors,
        List<BucketItem> items,
        @JsonInclude(JsonInclude.Include.NON_NULL) EmptyState emptyState
) {

    public TimelineBucket {
        topVendors = List.copyOf(topVendors);
        items = List.copyOf(items);
    }

    @JsonProperty("timeframe")
    public String timeframe() {
        return timeline.label();
    }

    public boolean isEmpty() {
        return gapCount == 0;
    }
}
