package com.findstaffing.core.repository;

import com.findstaffing.core.domain.AgencyRegion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for agency/region memberships.
 * Writes go through the unique (agency_id, region_id) key, never through entity saves.
 */
@Repository
public interface AgencyRegionRepository extends JpaRepository<AgencyRegion, AgencyRegion.Key> {

    /**
     * Region ids the agency currently belongs to.
     */
    @Query("SELECT m.id.regionId FROM AgencyRegion m WHERE m.id.agencyId = :agencyId")
    List<UUID> findRegionIds(@Param("agencyId") UUID agencyId);

    /**
     * Display names of the agency's current regions, ordered by name.
     */
    @Query("SELECT t.name FROM AgencyRegion m JOIN Region t ON t.id = m.id.regionId " +
           "WHERE m.id.agencyId = :agencyId ORDER BY t.name")
    List<String> findRegionNames(@Param("agencyId") UUID agencyId);

    /**
     * Inserts the membership unless it already exists.
     * Returns 1 when a row was created, 0 when it was already present.
     */
    @Modifying
    @Query(value = "INSERT INTO agency_regions (agency_id, region_id, created_at) " +
                   "VALUES (:agencyId, :regionId, :now) " +
                   "ON CONFLICT (agency_id, region_id) DO NOTHING",
           nativeQuery = true)
    int upsert(@Param("agencyId") UUID agencyId, @Param("regionId") UUID regionId, @Param("now") Instant now);

    /**
     * Deletes the given memberships of one agency only.
     */
    @Modifying
    @Query("DELETE FROM AgencyRegion m WHERE m.id.agencyId = :agencyId AND m.id.regionId IN :regionIds")
    int deleteMemberships(@Param("agencyId") UUID agencyId, @Param("regionIds") Collection<UUID> regionIds);
}
