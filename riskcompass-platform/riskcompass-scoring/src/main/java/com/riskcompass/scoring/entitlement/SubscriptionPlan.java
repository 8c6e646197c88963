package com.riskcompass.scoring.entitlement;

public enum SubscriptionPlan {
    FREE,
    PREMIUM,
    ENTERPRISE
}
