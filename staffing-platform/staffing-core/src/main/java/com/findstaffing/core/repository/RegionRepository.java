package com.findstaffing.core.repository;

import com.findstaffing.core.domain.Region;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for region reference rows.
 */
@Repository
public interface RegionRepository extends JpaRepository<Region, UUID> {

    /**
     * Existence check used before any membership is written.
     */
    List<Region> findByIdIn(Collection<UUID> ids);

    List<Region> findByIdInOrderByNameAsc(Collection<UUID> ids);
}
