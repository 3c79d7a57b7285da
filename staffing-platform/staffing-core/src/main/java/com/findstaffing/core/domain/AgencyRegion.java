package com.findstaffing.core.domain;

import jakarta.persistence.*;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Membership of an agency in a service region. At most one row per (agency, region) pair.
 */
@Entity
@Table(name = "agency_regions")
public class AgencyRegion {

    @EmbeddedId
    private Key id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected AgencyRegion() {}

    public AgencyRegion(UUID agencyId, UUID regionId) {
        this.id = new Key(agencyId, regionId);
        this.createdAt = Instant.now();
    }

    public UUID getAgencyId() { return id.agencyId; }
    public UUID getRegionId() { return id.regionId; }
    public Instant getCreatedAt() { return createdAt; }

    @Embeddable
    public static class Key implements Serializable {

        @Column(name = "agency_id", nullable = false)
        private UUID agencyId;

        @Column(name = "region_id", nullable = false)
        private UUID regionId;

        protected Key() {}

        public Key(UUID agencyId, UUID regionId) {
            this.agencyId = agencyId;
            this.regionId = regionId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key other)) return false;
            return Objects.equals(agencyId, other.agencyId) && Objects.equals(regionId, other.regionId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(agencyId, regionId);
        }
    }
}
