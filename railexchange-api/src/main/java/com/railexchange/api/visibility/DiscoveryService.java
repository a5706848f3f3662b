package com.railexchange.api.visibility;

import com.railexchange.api.entitlement.EntityStore;
import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Builds the public map and directory candidate lists from stored entities.
 */
@Service
public class DiscoveryService {

    private final EntityStore entityStore;
    private final VisibilityGate visibilityGate;
    private final Clock clock;

    public DiscoveryService(EntityStore entityStore, VisibilityGate visibilityGate, Clock clock) {
        this.entityStore = entityStore;
        this.visibilityGate = visibilityGate;
        this.clock = clock;
    }

    /**
     * Entities of a type that may be pinned on the map. Buyers are never returned.
     */
    public List<EntitySnapshot> mapEntries(EntityType type) {
        if (type == EntityType.BUYER) {
            return List.of();
        }
        Instant now = clock.instant();
        return visibilityGate.filterForMap(entityStore.findActive(type), now);
    }

    /**
     * Directory entries of a type, best ranked first.
     */
    public List<EntitySnapshot> directory(EntityType type) {
        Instant now = clock.instant();
        return visibilityGate.rankForDirectory(entityStore.findActive(type), now);
    }
}
