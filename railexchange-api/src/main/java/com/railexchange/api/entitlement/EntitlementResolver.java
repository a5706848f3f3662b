package com.railexchange.api.entitlement;

import com.railexchange.core.domain.EntitlementSet;
import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import com.railexchange.core.domain.TrustLevel;
import com.railexchange.core.domain.VerificationStatus;
import com.railexchange.core.domain.VisibilityTier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;

/**
 * Derives entitlements from entity type, verification status, visibility tier and expiry.
 *
 * Pure: no I/O, no clock reads, no state. The evaluation instant is always supplied by the
 * caller. Stored status and tier are advisory; the effective values derived here from the
 * expiry timestamps are authoritative.
 *
 * Unknown (null) type, status or tier resolves to {@link EntitlementSet#none()}, never to a
 * permissive guess and never to an exception.
 */
@Service
public class EntitlementResolver {

    /**
     * Resolves entitlements for an entity snapshot at {@code now}.
     */
    public EntitlementSet resolve(EntitySnapshot entity, Instant now) {
        if (entity == null) {
            return EntitlementSet.none();
        }
        return resolve(
                entity.type(),
                entity.verificationStatus(),
                entity.visibilityTier(),
                entity.verifiedBadgeExpiresAt(),
                entity.visibilityExpiresAt(),
                now
        );
    }

    /**
     * Resolves entitlements from raw stored values, as read from an external store.
     */
    public EntitlementSet resolve(String type, String verificationStatus, String visibilityTier,
                                  Instant verifiedBadgeExpiresAt, Instant visibilityExpiresAt,
                                  Instant now) {
        return resolve(
                EntityType.fromValue(type).orElse(null),
                VerificationStatus.fromValue(verificationStatus).orElse(null),
                VisibilityTier.fromValue(visibilityTier).orElse(null),
                verifiedBadgeExpiresAt,
                visibilityExpiresAt,
                now
        );
    }

    public EntitlementSet resolve(EntityType type, VerificationStatus verificationStatus,
                                  VisibilityTier visibilityTier,
                                  Instant verifiedBadgeExpiresAt, Instant visibilityExpiresAt,
                                  Instant now) {
        Objects.requireNonNull(now, "Evaluation instant cannot be null");

        if (type == null || verificationStatus == null || visibilityTier == null) {
            return EntitlementSet.none();
        }

        VerificationStatus status = effectiveStatus(verificationStatus, verifiedBadgeExpiresAt, visibilityExpiresAt, now);
        VisibilityTier tier = effectiveTier(visibilityTier, visibilityExpiresAt, now);

        boolean verified = status == VerificationStatus.VERIFIED;
        boolean listed = tier != VisibilityTier.HIDDEN;
        TrustLevel level = TrustLevel.of(type, status);

        EntitlementSet.Builder entitlements = EntitlementSet.builder()
                .hasVerifiedBadge(verified)
                .hasVisibilityBoost(type.isPromotable() && tier.isBoosted())
                .canAccessSellerFeatures(level.includes(TrustLevel.SELLER))
                .canAccessContractorFeatures(level.includes(TrustLevel.CONTRACTOR))
                .canListItems(level.includes(TrustLevel.SELLER));

        switch (type) {
            case SELLER -> entitlements
                    .canReceiveInquiries(verified && listed)
                    .canDisplayContact(verified)
                    .canDisplayListings(listed);
            case CONTRACTOR -> entitlements
                    .canReceiveInquiries(verified && listed)
                    .canDisplayContact(verified)
                    .canDisplayServices(listed)
                    .isSearchEligible(verified);
            case COMPANY -> entitlements
                    .canDisplayContact(listed)
                    .canDisplayCompanyInfo(listed);
            case BUYER -> {
                // buyers only ever carry a badge
            }
        }

        return entitlements.build();
    }

    /**
     * Once any expiry on record has passed, the status is expired whatever the stored value says.
     */
    public VerificationStatus effectiveStatus(VerificationStatus stored, Instant verifiedBadgeExpiresAt,
                                              Instant visibilityExpiresAt, Instant now) {
        if (stored == null) {
            return null;
        }
        if (hasElapsed(verifiedBadgeExpiresAt, now) || hasElapsed(visibilityExpiresAt, now)) {
            return VerificationStatus.EXPIRED;
        }
        return stored;
    }

    public VerificationStatus effectiveStatus(EntitySnapshot entity, Instant now) {
        return effectiveStatus(entity.verificationStatus(), entity.verifiedBadgeExpiresAt(),
                entity.visibilityExpiresAt(), now);
    }

    private static boolean hasElapsed(Instant expiry, Instant now) {
        return expiry != null && !expiry.isAfter(now);
    }

    /**
     * A boosted tier whose paid period has ended falls back to basic placement.
     */
    public VisibilityTier effectiveTier(VisibilityTier stored, Instant visibilityExpiresAt, Instant now) {
        if (stored == null) {
            return null;
        }
        if (stored.isBoosted() && hasElapsed(visibilityExpiresAt, now)) {
            return VisibilityTier.BASIC;
        }
        return stored;
    }

    /**
     * Whether the owner viewing their own profile should be offered an upgrade.
     */
    public boolean shouldShowUpgradePrompt(EntitySnapshot entity, boolean isOwner, Instant now) {
        if (entity == null || !isOwner || entity.type() == null || !entity.type().isPromotable()) {
            return false;
        }
        return effectiveTier(entity.visibilityTier(), entity.visibilityExpiresAt(), now) != VisibilityTier.PRIORITY;
    }
}
