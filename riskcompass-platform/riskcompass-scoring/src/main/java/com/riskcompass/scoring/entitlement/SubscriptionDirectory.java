package com.riskcompass.scoring.entitlement;

import java.util.Optional;

/**
 * Looks up the active plan of an organization. Empty when the organization has no usable
 * subscription.
 */
@FunctionalInterface
public interface SubscriptionDirectory {

    Optional<SubscriptionPlan> findPlan(String organizationId);
}
