package com.railexchange.api.visibility;

import com.railexchange.api.entitlement.EntitlementResolver;
import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import com.railexchange.core.domain.SubscriptionStatus;
import com.railexchange.core.domain.VerificationStatus;
import com.railexchange.core.domain.VisibilityTier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decides presence on public discovery surfaces (map, directory) and directory ranking.
 *
 * Read-only and pure: the gate never mutates entity state and never calls the payment
 * authority. Rules are evaluated as an ordered cascade where the first match wins:
 * buyers are never shown, sellers need Elite Placement, contractors and companies need
 * verification plus a paid professional plan.
 */
@Service
public class VisibilityGate {

    static final int VERIFIED_RANKING_BONUS = 100;

    private final EntitlementResolver entitlementResolver;

    public VisibilityGate(EntitlementResolver entitlementResolver) {
        this.entitlementResolver = entitlementResolver;
    }

    /**
     * Evaluates map visibility for an entity at {@code now}. Every result carries a reason.
     */
    public VisibilityResult checkVisibility(EntitySnapshot entity, Instant now) {
        Objects.requireNonNull(now, "Evaluation instant cannot be null");

        if (entity == null || entity.type() == null) {
            return VisibilityResult.hidden("Unknown entity type.");
        }

        return switch (entity.type()) {
            case BUYER -> VisibilityResult.hidden(
                    "Buyers are not shown on the map. Map is for professional discovery only.");
            case SELLER -> checkSeller(entity, now);
            case CONTRACTOR, COMPANY -> checkProfessional(entity, now);
        };
    }

    private VisibilityResult checkSeller(EntitySnapshot seller, Instant now) {
        if (hasActiveElite(seller, now)) {
            return VisibilityResult.visible(MapTier.ELITE,
                    "Elite Placement active. Seller is visible on map.");
        }
        return VisibilityResult.hidden(
                "Map visibility is available with Elite Placement. Sellers without Elite are not shown.");
    }

    private VisibilityResult checkProfessional(EntitySnapshot entity, Instant now) {
        VerificationStatus status = entitlementResolver.effectiveStatus(entity, now);
        if (status != VerificationStatus.VERIFIED) {
            return VisibilityResult.hidden(
                    entity.type().label() + " must be verified to appear on map.");
        }
        if (!entity.active() || !entity.published()) {
            return VisibilityResult.hidden(
                    entity.type().label() + " profile is not active or published.");
        }
        if (!hasPaidPlan(entity, now)) {
            return VisibilityResult.hidden(
                    "Map visibility requires Professional Marketplace Access ($2,500/year).");
        }
        return VisibilityResult.visible(MapTier.PROFESSIONAL,
                "Professional Plan active. " + entity.type().label() + " is visible on map.");
    }

    static boolean hasActiveElite(EntitySnapshot seller, Instant now) {
        return seller.eliteActive()
                && seller.eliteExpiresAt() != null
                && seller.eliteExpiresAt().isAfter(now);
    }

    /**
     * Featured and priority tiers are paid on their own. A basic tier only counts when a
     * plan subscription backs it and that subscription is not recorded as ended.
     */
    private boolean hasPaidPlan(EntitySnapshot entity, Instant now) {
        VisibilityTier tier = entitlementResolver.effectiveTier(
                entity.visibilityTier(), entity.visibilityExpiresAt(), now);
        if (tier == null) {
            return false;
        }
        return switch (tier) {
            case FEATURED, PRIORITY -> true;
            case BASIC -> entity.hasSubscription() && !isRecordedAsEnded(entity.subscriptionStatusCached());
            case HIDDEN -> false;
        };
    }

    private static boolean isRecordedAsEnded(SubscriptionStatus cached) {
        return cached != null && cached.isTerminal();
    }

    /**
     * Directory ranking score. Higher sorts first; ties are broken by the caller.
     */
    public int directoryRankingPriority(EntitySnapshot entity, Instant now) {
        if (entity == null || entity.type() == null || !entity.type().isPromotable()) {
            return 0;
        }
        int priority = 0;
        if (entitlementResolver.effectiveStatus(entity, now) == VerificationStatus.VERIFIED) {
            priority += VERIFIED_RANKING_BONUS;
        }
        VisibilityTier tier = entitlementResolver.effectiveTier(
                entity.visibilityTier(), entity.visibilityExpiresAt(), now);
        if (tier != null) {
            priority += tier.rankingBonus();
        }
        return priority;
    }

    /**
     * Directory listing presence. Hidden tiers, inactive profiles and buyers stay out.
     */
    public boolean shouldAppearInDirectory(EntitySnapshot entity, Instant now) {
        if (entity == null || entity.type() == null || entity.type() == EntityType.BUYER) {
            return false;
        }
        if (!entity.active()) {
            return false;
        }
        VisibilityTier tier = entitlementResolver.effectiveTier(
                entity.visibilityTier(), entity.visibilityExpiresAt(), now);
        return tier != null && tier != VisibilityTier.HIDDEN;
    }

    /**
     * Keeps only the entities that may be pinned on the map, preserving input order.
     */
    public List<EntitySnapshot> filterForMap(List<EntitySnapshot> entities, Instant now) {
        return entities.stream()
                .filter(entity -> checkVisibility(entity, now).visible())
                .toList();
    }

    /**
     * Directory entries sorted by ranking priority, highest first. Sort is stable.
     */
    public List<EntitySnapshot> rankForDirectory(List<EntitySnapshot> entities, Instant now) {
        return entities.stream()
                .filter(entity -> shouldAppearInDirectory(entity, now))
                .sorted(Comparator.comparingInt((EntitySnapshot entity) -> directoryRankingPriority(entity, now))
                        .reversed())
                .toList();
    }

    /**
     * Map pin tier.
     */
    public enum MapTier {
        PROFESSIONAL("professional"),
        ELITE("elite");

        private final String value;

        MapTier(String value) {
            this.value = value;
        }

        public String value() { return value; }
    }

    public record VisibilityResult(boolean visible, MapTier tier, String reason) {

        static VisibilityResult visible(MapTier tier, String reason) {
            return new VisibilityResult(true, tier, reason);
        }

        static VisibilityResult hidden(String reason) {
            return new VisibilityResult(false, null, reason);
        }
    }
}
