package com.railexchange.api.entitlement;

import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to entity state. Snapshots are point-in-time copies.
 */
public interface EntityStore {

    Optional<EntitySnapshot> find(UUID id);

    /**
     * Active entities of a type, the candidate set for discovery surfaces.
     */
    List<EntitySnapshot> findActive(EntityType type);
}
