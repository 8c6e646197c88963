package com.riskcompass.api.entitlement;

import com.riskcompass.core.domain.Subscription;
import com.riskcompass.core.repository.SubscriptionRepository;
import com.riskcompass.scoring.entitlement.SubscriptionDirectory;
import com.riskcompass.scoring.entitlement.SubscriptionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Subscription lookup backed by the subscriptions table.
 * Canceled or unpaid subscriptions resolve as absent.
 */
@Component
public class JpaSubscriptionDirectory implements SubscriptionDirectory {

    private static final Logger log = LoggerFactory.getLogger(JpaSubscriptionDirectory.class);

    private final SubscriptionRepository subscriptionRepository;

    public JpaSubscriptionDirectory(SubscriptionRepository subscriptionRepository) {
        this.subscriptionRepository = subscriptionRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<SubscriptionPlan> findPlan(String organizationId) {
        UUID orgId;
        try {
            orgId = UUID.fromString(organizationId);
        } catch (IllegalArgumentException e) {
            log.warn("Organization id '{}' is not a UUID, treating as unknown", organizationId);
            return Optional.empty();
        }
        return subscriptionRepository.findByOrganizationId(orgId)
                .filter(Subscription::isInGoodStanding)
                .map(Subscription::getPlan);
    }
}
