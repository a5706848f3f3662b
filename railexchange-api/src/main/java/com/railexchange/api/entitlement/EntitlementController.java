package com.railexchange.api.entitlement;

import com.railexchange.api.entitlement.EntitlementService.LiveEntitlements;
import com.railexchange.api.subscription.SubscriptionVerifier.SubscriptionVerification;
import com.railexchange.api.visibility.VisibilityGate;
import com.railexchange.api.visibility.VisibilityGate.VisibilityResult;
import com.railexchange.core.domain.EntitlementSet;
import com.railexchange.core.domain.EntitySnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Entitlement and visibility lookups for a single entity.
 * GET /api/v1/entities/{id}/entitlements
 * GET /api/v1/entities/{id}/visibility
 */
@RestController
@RequestMapping("/api/v1/entities")
public class EntitlementController {

    private final EntitlementService entitlementService;
    private final VisibilityGate visibilityGate;
    private final EntityStore entityStore;
    private final Clock clock;

    public EntitlementController(EntitlementService entitlementService,
                                 VisibilityGate visibilityGate,
                                 EntityStore entityStore,
                                 Clock clock) {
        this.entitlementService = entitlementService;
        this.visibilityGate = visibilityGate;
        this.entityStore = entityStore;
        this.clock = clock;
    }

    @GetMapping("/{id}/entitlements")
    public ResponseEntity<EntitlementResponse> entitlements(@PathVariable UUID id) {
        Optional<EntitySnapshot> entity = entityStore.find(id);
        if (entity.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        LiveEntitlements live = entitlementService.resolveLive(entity.get());
        SubscriptionVerification subscription = live.subscription();
        return ResponseEntity.ok(new EntitlementResponse(
                id,
                live.entitlements(),
                subscription == null ? null : subscription.valid(),
                subscription == null ? null : subscription.source().value()
        ));
    }

    @GetMapping("/{id}/visibility")
    public ResponseEntity<VisibilityResponse> visibility(@PathVariable UUID id) {
        Optional<EntitySnapshot> entity = entityStore.find(id);
        if (entity.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        VisibilityResult result = visibilityGate.checkVisibility(entity.get(), clock.instant());
        return ResponseEntity.ok(new VisibilityResponse(
                id,
                result.visible(),
                result.tier() == null ? null : result.tier().value(),
                result.reason()
        ));
    }

    public record EntitlementResponse(
            UUID entityId,
            EntitlementSet entitlements,
            Boolean subscriptionValid,
            String subscriptionSource
    ) {}

    public record VisibilityResponse(UUID entityId, boolean visible, String tier, String reason) {}
}
