package com.findstaffing.core.repository;

import com.findstaffing.core.domain.Trade;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for trade reference rows.
 */
@Repository
public interface TradeRepository extends JpaRepository<Trade, UUID> {

    /**
     * Existence check used before any membership is written.
     */
    List<Trade> findByIdIn(Collection<UUID> ids);

    List<Trade> findByIdInOrderByNameAsc(Collection<UUID> ids);
}
