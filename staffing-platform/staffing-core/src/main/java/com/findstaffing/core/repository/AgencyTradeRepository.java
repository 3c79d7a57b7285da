package com.findstaffing.core.repository;

import com.findstaffing.core.domain.AgencyTrade;
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
 * Repository for agency/trade memberships.
 * Writes go through the unique (agency_id, trade_id) key, never through entity saves.
 */
@Repository
public interface AgencyTradeRepository extends JpaRepository<AgencyTrade, AgencyTrade.Key> {

    /**
     * Trade ids the agency currently belongs to.
     */
    @Query("SELECT m.id.tradeId FROM AgencyTrade m WHERE m.id.agencyId = :agencyId")
    List<UUID> findTradeIds(@Param("agencyId") UUID agencyId);

    /**
     * Display names of the agency's current trades, ordered by name.
     */
    @Query("SELECT t.name FROM AgencyTrade m JOIN Trade t ON t.id = m.id.tradeId " +
           "WHERE m.id.agencyId = :agencyId ORDER BY t.name")
    List<String> findTradeNames(@Param("agencyId") UUID agencyId);

    /**
     * Inserts the membership unless it already exists.
     * Returns 1 when a row was created, 0 when it was already present.
     */
    @Modifying
    @Query(value = "INSERT INTO agency_trades (agency_id, trade_id, created_at) " +
                   "VALUES (:agencyId, :tradeId, :now) " +
                   "ON CONFLICT (agency_id, trade_id) DO NOTHING",
           nativeQuery = true)
    int upsert(@Param("agencyId") UUID agencyId, @Param("tradeId") UUID tradeId, @Param("now") Instant now);

    /**
     * Deletes the given memberships of one agency only.
     */
    @Modifying
    @Query("DELETE FROM AgencyTrade m WHERE m.id.agencyId = :agencyId AND m.id.tradeId IN :tradeIds")
    int deleteMemberships(@Param("agencyId") UUID agencyId, @Param("tradeIds") Collection<UUID> tradeIds);
}
