package com.riskcompass.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Remediation vendor. Only APPROVED vendors are recommended.
 */
@Entity
@Table(name = "vendors")
public class Vendor {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(nullable = false)
    private String name;

    @Column(name = "website")
    private String website;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private VendorStatus status;

    /** Gap categories this vendor can remediate. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "categories", columnDefinition = "jsonb")
    private List<String> categories;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum VendorStatus {
        PENDING,
        APPROVED,
        SUSPENDED
    }

    protected Vendor() {}

    public static Vendor create(String name, String website, List<String> categories) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Vendor name cannot be null or blank");
        }
        Vendor vendor = new Vendor();
        vendor.id = UUID.randomUUID();
        vendor.name = name;
        vendor.website = website;
        vendor.categories = categories == null ? List.of() : List.copyOf(categories);
        vendor.status = VendorStatus.PENDING;
        vendor.createdAt = Instant.now();
        return vendor;
    }

    public void approve() {
        if (status == VendorStatus.APPROVED) {
            throw new IllegalStateException("Vendor is already approved");
        }
        status = VendorStatus.APPROVED;
    }

    public void suspend() {
        status = VendorStatus.SUSPENDED;
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getWebsite() { return website; }
    public VendorStatus getStatus() { return status; }
    public List<String> getCategories() { return categories; }
    public Instant getCreatedAt() { return createdAt; }
}
