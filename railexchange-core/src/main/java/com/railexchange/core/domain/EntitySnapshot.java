package com.railexchange.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable, already-resolved view of an entity's state as read from the entity store.
 *
 * {@code type}, {@code verificationStatus} and {@code visibilityTier} are null when the stored
 * value could not be recognised. Consumers must treat null as "unknown" and fail closed.
 */
public record EntitySnapshot(
        UUID id,
        EntityType type,
        VerificationStatus verificationStatus,
        VisibilityTier visibilityTier,
        Instant verifiedBadgeExpiresAt,
        Instant visibilityExpiresAt,
        boolean active,
        boolean published,
        boolean eliteActive,
        Instant eliteExpiresAt,
        String subscriptionId,
        SubscriptionStatus subscriptionStatusCached,
        boolean emailVerified,
        Instant createdAt,
        AbuseSignals abuseSignals
) {

    public EntitySnapshot {
        if (abuseSignals == null) {
            abuseSignals = AbuseSignals.clean();
        }
    }

    public boolean hasSubscription() {
        return subscriptionId != null && !subscriptionId.isBlank();
    }

    public static Builder builder(EntityType type) {
        return new Builder().type(type);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .verificationStatus(verificationStatus)
                .visibilityTier(visibilityTier)
                .verifiedBadgeExpiresAt(verifiedBadgeExpiresAt)
                .visibilityExpiresAt(visibilityExpiresAt)
                .active(active)
                .published(published)
                .eliteActive(eliteActive)
                .eliteExpiresAt(eliteExpiresAt)
                .subscriptionId(subscriptionId)
                .subscriptionStatusCached(subscriptionStatusCached)
                .emailVerified(emailVerified)
                .createdAt(createdAt)
                .abuseSignals(abuseSignals);
    }

    public static final class Builder {
        private UUID id = UUID.randomUUID();
        private EntityType type;
        private VerificationStatus verificationStatus = VerificationStatus.NONE;
        private VisibilityTier visibilityTier = VisibilityTier.HIDDEN;
        private Instant verifiedBadgeExpiresAt;
        private Instant visibilityExpiresAt;
        private boolean active = true;
        private boolean published = true;
        private boolean eliteActive;
        private Instant eliteExpiresAt;
        private String subscriptionId;
        private SubscriptionStatus subscriptionStatusCached;
        private boolean emailVerified = true;
        private Instant createdAt;
        private AbuseSignals abuseSignals = AbuseSignals.clean();

        private Builder() {}

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder type(EntityType type) { this.type = type; return this; }
        public Builder verificationStatus(VerificationStatus status) { this.verificationStatus = status; return this; }
        public Builder visibilityTier(VisibilityTier tier) { this.visibilityTier = tier; return this; }
        public Builder verifiedBadgeExpiresAt(Instant at) { this.verifiedBadgeExpiresAt = at; return this; }
        public Builder visibilityExpiresAt(Instant at) { this.visibilityExpiresAt = at; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder published(boolean published) { this.published = published; return this; }
        public Builder eliteActive(boolean eliteActive) { this.eliteActive = eliteActive; return this; }
        public Builder eliteExpiresAt(Instant at) { this.eliteExpiresAt = at; return this; }
        public Builder subscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; return this; }
        public Builder subscriptionStatusCached(SubscriptionStatus status) { this.subscriptionStatusCached = status; return this; }
        public Builder emailVerified(boolean emailVerified) { this.emailVerified = emailVerified; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder abuseSignals(AbuseSignals signals) { this.abuseSignals = signals; return this; }

        public EntitySnapshot build() {
            return new EntitySnapshot(
                    id, type, verificationStatus, visibilityTier,
                    verifiedBadgeExpiresAt, visibilityExpiresAt,
                    active, published, eliteActive, eliteExpiresAt,
                    subscriptionId, subscriptionStatusCached,
                    emailVerified, createdAt, abuseSignals
            );
        }
    }
}
