package com.findstaffing.core.repository;

import com.findstaffing.core.domain.AgencyCompliance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for agency compliance rows, unique per (agency_id, compliance_type).
 */
@Repository
public interface AgencyComplianceRepository extends JpaRepository<AgencyCompliance, UUID> {

    Optional<AgencyCompliance> findByAgencyIdAndComplianceType(UUID agencyId, String complianceType);

    List<AgencyCompliance> findByAgencyIdOrderByComplianceTypeAsc(UUID agencyId);

    /**
     * Points the row at a freshly uploaded document, creating it when absent.
     * The document is pending review afterwards. An existing row keeps its
     * active flag, expiration date and notes; a new row starts inactive.
     */
    @Modifying(clearAutomatically = true)
    @Query(value = "INSERT INTO agency_compliance " +
                   "(id, agency_id, compliance_type, document_url, is_verified, is_active, created_at, updated_at) " +
                   "VALUES (:id, :agencyId, :complianceType, :documentUrl, false, false, :now, :now) " +
                   "ON CONFLICT (agency_id, compliance_type) DO UPDATE SET " +
                   "document_url = EXCLUDED.document_url, is_verified = false, " +
                   "verified_by = NULL, verified_at = NULL, updated_at = EXCLUDED.updated_at",
           nativeQuery = true)
    int upsertDocument(
            @Param("id") UUID id,
            @Param("agencyId") UUID agencyId,
            @Param("complianceType") String complianceType,
            @Param("documentUrl") String documentUrl,
            @Param("now") Instant now);
}
