package com.riskcompass.scoring.strategy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Remediation roadmap: always exactly three buckets, in timeline order.
 */
public record StrategyMatrix(
        @JsonInclude(JsonInclude.Include.NON_NULL) String assessmentId,
        @JsonProperty("isRestricted") boolean restricted,
        String summary,
        List<TimelineBucket> buckets
) {

    public StrategyMatrix {
        buckets = List.copyOf(buckets);
        if (buckets.size() != Timeline.values().length) {
            throw new IllegalArgumentException("Strategy matrix needs one bucket per timeline");
        }
    }

    public TimelineBucket bucket(Timeline timeline) {
        return buckets.get(timeline.ordinal());
    }

    @JsonProperty("totalGaps")
    public int totalGaps() {
        return buckets.stream().mapToInt(TimelineBucket::gapCount).sum();
    }
}
