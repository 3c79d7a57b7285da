package com.findstaffing.core.domain;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Membership of an agency in a trade. At most one row per (agency, trade) pair.
 */
@Entity
@Table(name = "agency_trades")
public class AgencyTrade {

    @EmbeddedId
    private Key id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected AgencyTrade() {}

    public AgencyTrade(UUID agencyId, UUID tradeId) {
        this.id = new Key(agencyId, tradeId);
        this.createdAt = Instant.now();
    }

    public UUID getAgencyId() { return id.agencyId; }
    public UUID getTradeId() { return id.tradeId; }
    public Instant getCreatedAt() { return createdAt; }

    @Embeddable
    public static class Key implements Serializable {

        @Column(name = "agency_id", nullable = false)
        private UUID agencyId;

        @Column(name = "trade_id", nullable = false)
        private UUID tradeId;

        protected Key() {}

        public Key(UUID agencyId, UUID tradeId) {
            this.agencyId = agencyId;
            this.tradeId = tradeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(agencyId, other.agencyId) && Objects.equals(tradeId, other.tradeId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(agencyId, tradeId);
        }
    }
}
