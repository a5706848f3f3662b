package com.railexchange.api.entitlement;

import com.railexchange.api.subscription.SubscriptionVerifier;
import com.railexchange.api.subscription.SubscriptionVerifier.SubscriptionVerification;
import com.railexchange.core.domain.EntitlementSet;
import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import com.railexchange.core.domain.SubscriptionStatus;
import com.railexchange.core.domain.VerificationStatus;
import com.railexchange.core.domain.VisibilityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Entitlements backed by the live subscription state at the payment authority.
 *
 * The pure resolver trusts stored status and tier (after expiry normalization). This service
 * additionally confirms the backing subscription and downgrades when the authority does not
 * vouch for it: a seller loses verification, a contractor or company loses its paid boost.
 */
@Service
public class EntitlementService {

    private static final Logger log = LoggerFactory.getLogger(EntitlementService.class);

    private final EntitlementResolver resolver;
    private final SubscriptionVerifier subscriptionVerifier;
    private final EntityStore entityStore;
    private final Clock clock;

    public EntitlementService(EntitlementResolver resolver,
                              SubscriptionVerifier subscriptionVerifier,
                              EntityStore entityStore,
                              Clock clock) {
        this.resolver = resolver;
        this.subscriptionVerifier = subscriptionVerifier;
        this.entityStore = entityStore;
        this.clock = clock;
    }

    /**
     * Resolves entitlements for a stored entity. Unknown ids resolve to nothing.
     */
    public LiveEntitlements resolveLive(UUID entityId) {
        return entityStore.find(entityId)
                .map(this::resolveLive)
                .orElseGet(() -> new LiveEntitlements(EntitlementSet.none(), null));
    }

    public LiveEntitlements resolveLive(EntitySnapshot entity) {
        Instant now = clock.instant();
        if (entity == null || entity.type() == null) {
            return new LiveEntitlements(EntitlementSet.none(), null);
        }
        if (!entity.hasSubscription() || !entity.type().isPromotable()) {
            return new LiveEntitlements(resolver.resolve(entity, now), null);
        }

        SubscriptionVerification verification = subscriptionVerifier.verifyWithStoredStatus(
                entity.subscriptionId(), entity.subscriptionStatusCached());
        if (verification.valid()) {
            return new LiveEntitlements(resolver.resolve(entity, now), verification);
        }

        log.debug("Subscription {} not confirmed for entity {}: {}",
                entity.subscriptionId(), entity.id(), verification.error());
        return new LiveEntitlements(resolver.resolve(downgrade(entity), now), verification);
    }

    private EntitySnapshot downgrade(EntitySnapshot entity) {
        if (entity.type() == EntityType.SELLER) {
            return entity.toBuilder()
                    .verificationStatus(VerificationStatus.EXPIRED)
                    .build();
        }
        VisibilityTier tier = entity.visibilityTier();
        if (tier != null && tier.isBoosted()) {
            return entity.toBuilder()
                    .visibilityTier(VisibilityTier.BASIC)
                    .build();
        }
        return entity;
    }

    /**
     * Whether a seller's paid verification is currently in force: no expiry elapsed, stored
     * status verified and, when a subscription backs it, confirmed by the authority.
     */
    public ActivationCheck hasActiveSellerVerification(EntitySnapshot entity) {
        if (entity == null || entity.type() != EntityType.SELLER) {
            return ActivationCheck.inactive("Not a seller account");
        }
        Instant now = clock.instant();
        VerificationStatus effective = resolver.effectiveStatus(entity, now);
        if (effective == VerificationStatus.EXPIRED && entity.verificationStatus() != VerificationStatus.EXPIRED) {
            return ActivationCheck.inactive("Verification expired");
        }
        if (entity.verificationStatus() != VerificationStatus.VERIFIED) {
            return ActivationCheck.inactive("Verification not active");
        }
        if (entity.hasSubscription()) {
            SubscriptionVerification verification = subscriptionVerifier.verifyWithStoredStatus(
                    entity.subscriptionId(), entity.subscriptionStatusCached());
            if (!verification.valid()) {
                return ActivationCheck.inactive(reasonFor(verification));
            }
        }
        return ActivationCheck.ACTIVE;
    }

    /**
     * Whether a contractor or company holds an active professional plan: paid period not
     * ended, stored subscription status active or trialing and confirmed by the authority.
     */
    public ActivationCheck hasActiveContractorVisibility(EntitySnapshot entity) {
        if (entity == null || (entity.type() != EntityType.CONTRACTOR && entity.type() != EntityType.COMPANY)) {
            return ActivationCheck.inactive("Not a contractor or company account");
        }
        Instant now = clock.instant();
        if (entity.visibilityExpiresAt() != null && !entity.visibilityExpiresAt().isAfter(now)) {
            return ActivationCheck.inactive("Subscription period ended");
        }
        SubscriptionStatus stored = entity.subscriptionStatusCached();
        if (stored == null || !stored.grantsAccess()) {
            return ActivationCheck.inactive("Subscription not active");
        }
        if (entity.hasSubscription()) {
            SubscriptionVerification verification = subscriptionVerifier.verify(entity.subscriptionId());
            if (!verification.valid()) {
                return ActivationCheck.inactive(reasonFor(verification));
            }
        }
        return ActivationCheck.ACTIVE;
    }

    private static String reasonFor(SubscriptionVerification verification) {
        return verification.error() != null ? verification.error() : "Subscription not active";
    }

    /**
     * Entitlements plus the subscription answer they were based on, if one was needed.
     */
    public record LiveEntitlements(EntitlementSet entitlements, SubscriptionVerification subscription) {}

    public record ActivationCheck(boolean active, String reason) {

        static final ActivationCheck ACTIVE = new ActivationCheck(true, null);

        static ActivationCheck inactive(String reason) {
            return new ActivationCheck(false, reason);
        }
    }
}
