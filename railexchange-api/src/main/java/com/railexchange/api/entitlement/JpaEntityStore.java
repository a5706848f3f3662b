package com.railexchange.api.entitlement;

import com.railexchange.core.domain.EntitySnapshot;
import com.railexchange.core.domain.EntityType;
import com.railexchange.core.domain.MarketplaceEntity;
import com.railexchange.core.repository.MarketplaceEntityRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entity store backed by the marketplace_entities table.
 */
@Component
public class JpaEntityStore implements EntityStore {

    private final MarketplaceEntityRepository repository;

    public JpaEntityStore(MarketplaceEntityRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EntitySnapshot> find(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository.findById(id).map(MarketplaceEntity::toSnapshot);
    }

    @Override
    @Transactional(readOnly = true)
    public List<EntitySnapshot> findActive(EntityType type) {
        return repository.findActiveByEntityType(type.value()).stream()
                .map(MarketplaceEntity::toSnapshot)
                .toList();
    }
}
