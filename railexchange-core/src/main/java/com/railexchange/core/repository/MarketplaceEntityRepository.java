package com.railexchange.core.repository;

import com.railexchange.core.domain.MarketplaceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for MarketplaceEntity rows.
 */
@Repository
public interface MarketplaceEntityRepository extends JpaRepository<MarketplaceEntity, UUID> {

    /**
     * Candidates for public discovery surfaces. Final visibility is decided by the
     * visibility rules at read time, this only narrows the scan.
     */
    @Query("SELECT e FROM MarketplaceEntity e WHERE e.entityType = :entityType AND e.active = true")
    List<MarketplaceEntity> findActiveByEntityType(@Param("entityType") String entityType);
}
