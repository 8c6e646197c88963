package com.riskcompass.scoring.entitlement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Single decision point for premium analysis access.
 * Fails closed: an unknown organization or a missing subscription gets the restricted path.
 */
public class EntitlementGate {

    private static final Logger log = LoggerFactory.getLogger(EntitlementGate.class);

    private final SubscriptionDirectory subscriptions;

    public EntitlementGate(SubscriptionDirectory subscriptions) {
        if (subscriptions == null) {
            throw new IllegalArgumentException("Subscription directory cannot be null");
        }
        this.subscriptions = subscriptions;
    }

    /**
     * FREE and unknown organizations are gated; PREMIUM and ENTERPRISE are not.
     */
    public boolean canAccessFullAnalysis(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            log.warn("Entitlement check without organization id, access denied");
            return false;
        }
        Optional<SubscriptionPlan> plan = subscriptions.findPlan(organizationId);
        if (plan.isEmpty()) {
            log.warn("No subscription found for organization {}, using restricted analysis", organizationId);
            return false;
        }
        boolean allowed = plan.get() != SubscriptionPlan.FREE;
        log.info("Organization {} on plan {}: full analysis {}", organizationId, plan.get(),
                allowed ? "granted" : "restricted");
        return allowed;
    }

    /**
     * Whether gap and strategy generators should compute real output or the restricted mock.
     */
    public boolean shouldGenerateRealAnalysis(String organizationId) {
        return canAccessFullAnalysis(organizationId);
    }
}
