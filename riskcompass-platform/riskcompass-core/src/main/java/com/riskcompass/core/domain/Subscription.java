package com.riskcompass.core.domain;

import com.riskcompass.scoring.entitlement.SubscriptionPlan;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Billing plan of an organization, as last reported by the billing provider.
 */
@Entity
@Table(name = "subscriptions")
public class Subscription {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "organization_id", nullable = false, unique = true)
    private UUID organizationId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionPlan plan;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SubscriptionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public enum SubscriptionStatus {
        ACTIVE,
        TRIALING,
        PAST_DUE,
        CANCELED,
        UNPAID
    }

    protected Subscription() {}

    public static Subscription create(UUID organizationId, SubscriptionPlan plan) {
        if (organizationId == null) {
            throw new IllegalArgumentException("Organization ID cannot be null");
        }
        if (plan == null) {
            throw new IllegalArgumentException("Plan cannot be null");
        }
        Subscription subscription = new Subscription();
        subscription.id = UUID.randomUUID();
        subscription.organizationId = organizationId;
        subscription.plan = plan;
        subscription.status = SubscriptionStatus.ACTIVE;
        subscription.createdAt = Instant.now();
        subscription.updatedAt = subscription.createdAt;
        return subscription;
    }

    public void changePlan(SubscriptionPlan plan) {
        if (plan == null) {
            throw new IllegalArgumentException("Plan cannot be null");
        }
        this.plan = plan;
        this.updatedAt = Instant.now();
    }

    public void updateStatus(SubscriptionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        this.status = status;
        this.updatedAt = Instant.now();
    }

    /**
     * Canceled and unpaid subscriptions grant nothing.
     */
    public boolean isInGoodStanding() {
        return status != SubscriptionStatus.CANCELED && status != SubscriptionStatus.UNPAID;
    }

    public UUID getId() { return id; }
    public UUID getOrganizationId() { return organizationId; }
    public SubscriptionPlan getPlan() { return plan; }
    public SubscriptionStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
