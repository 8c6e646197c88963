package com.riskcompass.scoring.gap;

public record GapPrioritization(
        Severity severity,
        int priorityScore,
        Priority priority,
        EffortSize effort,
        CostRange cost
) {
}
