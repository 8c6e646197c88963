package com.riskcompass.scoring.strategy;

import com.riskcompass.scoring.gap.Severity;

public record BucketItem(String gapId, String title, Severity severity, String description) {
}
