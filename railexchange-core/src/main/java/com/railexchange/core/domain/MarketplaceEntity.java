package com.railexchange.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * MarketplaceEntity - persisted state of a seller, contractor, company or buyer account.
 *
 * Type, verification status, visibility tier and cached subscription status are stored as
 * plain strings. The stored values are advisory: they are parsed into the closed enum sets
 * when a snapshot is taken, and anything unrecognised is surfaced as unknown so that the
 * entitlement rules fail closed instead of failing the read.
 *
 * Verification, tier, add-on and abuse fields are written by external review, billing and
 * moderation workflows. The entitlement engine only reads them.
 */
@Entity
@Table(name = "marketplace_entities", indexes = {
    @Index(name = "idx_me_type", columnList = "entity_type"),
    @Index(name = "idx_me_verification", columnList = "verification_status"),
    @Index(name = "idx_me_subscription", columnList = "subscription_id")
})
public class MarketplaceEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "entity_type", nullable = false, length = 32)
    private String entityType;

    @NotNull
    @Column(name = "verification_status", nullable = false, length = 32)
    private String verificationStatus;

    @NotNull
    @Column(name = "visibility_tier", nullable = false, length = 32)
    private String visibilityTier;

    @Column(name = "verified_badge_expires_at")
    private Instant verifiedBadgeExpiresAt;

    @Column(name = "visibility_expires_at")
    private Instant visibilityExpiresAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "is_published", nullable = false)
    private boolean published;

    @Column(name = "elite_active", nullable = false)
    private boolean eliteActive;

    @Column(name = "elite_expires_at")
    private Instant eliteExpiresAt;

    @Column(name = "subscription_id")
    private String subscriptionId;

    @Column(name = "subscription_status", length = 32)
    private String subscriptionStatus;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "rejected_report_count", nullable = false)
    private int rejectedReportCount;

    @Column(name = "spam_flag_count", nullable = false)
    private int spamFlagCount;

    @Column(name = "report_rate_limited_until")
    private Instant reportRateLimitedUntil;

    @Column(name = "last_rejected_report_at")
    private Instant lastRejectedReportAt;

    @Column(name = "last_spam_flag_at")
    private Instant lastSpamFlagAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected MarketplaceEntity() {}

    /**
     * Registers a new entity. New entities start unverified, hidden and active.
     */
    public static MarketplaceEntity register(EntityType type, Instant now) {
        MarketplaceEntity entity = new MarketplaceEntity();
        entity.id = UUID.randomUUID();
        entity.entityType = type.value();
        entity.verificationStatus = VerificationStatus.NONE.value();
        entity.visibilityTier = VisibilityTier.HIDDEN.value();
        entity.active = true;
        entity.published = false;
        entity.createdAt = now;
        entity.updatedAt = now;
        return entity;
    }

    /**
     * Projects the stored row into the immutable view consumed by the entitlement engine.
     */
    public EntitySnapshot toSnapshot() {
        return new EntitySnapshot(
                id,
                EntityType.fromValue(entityType).orElse(null),
                VerificationStatus.fromValue(verificationStatus).orElse(null),
                VisibilityTier.fromValue(visibilityTier).orElse(null),
                verifiedBadgeExpiresAt,
                visibilityExpiresAt,
                active,
                published,
                eliteActive,
                eliteExpiresAt,
                subscriptionId,
                subscriptionStatus == null ? null : SubscriptionStatus.fromValue(subscriptionStatus),
                emailVerified,
                createdAt,
                new AbuseSignals(
                        rejectedReportCount,
                        spamFlagCount,
                        reportRateLimitedUntil,
                        lastRejectedReportAt,
                        lastSpamFlagAt
                )
        );
    }

    // Getters
    public UUID getId() { return id; }
    public String getEntityType() { return entityType; }
    public String getVerificationStatus() { return verificationStatus; }
    public String getVisibilityTier() { return visibilityTier; }
    public Instant getVerifiedBadgeExpiresAt() { return verifiedBadgeExpiresAt; }
    public Instant getVisibilityExpiresAt() { return visibilityExpiresAt; }
    public boolean isActive() { return active; }
    public boolean isPublished() { return published; }
    public boolean isEliteActive() { return eliteActive; }
    public Instant getEliteExpiresAt() { return eliteExpiresAt; }
    public String getSubscriptionId() { return subscriptionId; }
    public String getSubscriptionStatus() { return subscriptionStatus; }
    public boolean isEmailVerified() { return emailVerified; }
    public int getRejectedReportCount() { return rejectedReportCount; }
    public int getSpamFlagCount() { return spamFlagCount; }
    public Instant getReportRateLimitedUntil() { return reportRateLimitedUntil; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
