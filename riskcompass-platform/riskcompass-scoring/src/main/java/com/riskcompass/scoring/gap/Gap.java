package com.riskcompass.scoring.gap;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A compliance gap. Derived from a score result, never persisted.
 *
 * @param questionId question the gap was raised for; null for restricted placeholder gaps
 * @param priorityScore 1-10, null when restricted
 * @param restricted true when the content is a placeholder shown to gated callers
 */
public record Gap(
        String id,
        String assessmentId,
        @JsonInclude(JsonInclude.Include.NON_NULL) String questionId,
        String category,
        String title,
        String description,
        Severity severity,
        Priority priority,
        Integer priorityScore,
        CostRange estimatedCost,
        EffortSize estimatedEffort,
        List<String> suggestedVendors,
        @JsonProperty("isRestricted") boolean restricted
) {

    public Gap {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Gap ID cannot be null or blank");
        }
        if (priorityScore != null && (priorityScore < 1 || priorityScore > 10)) {
            throw new IllegalArgumentException("Priority score must be between 1 and 10");
        }
        suggestedVendors = suggestedVendors == null ? List.of() : List.copyOf(suggestedVendors);
    }
}
