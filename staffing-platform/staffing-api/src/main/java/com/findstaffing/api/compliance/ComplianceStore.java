package com.findstaffing.api.compliance;

import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceDocumentState;
import com.findstaffing.core.domain.ComplianceType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Compliance status rows, one per (agency, compliance type).
 */
public interface ComplianceStore {

    Optional<AgencyCompliance> find(UUID agencyId, ComplianceType type);

    /**
     * All rows of an agency, ordered by compliance type.
     */
    List<AgencyCompliance> findAll(UUID agencyId);

    /**
     * Creates or updates the row so it points at a newly uploaded document.
     * The active flag of an existing row is preserved; a new row is inactive.
     */
    AgencyCompliance upsertDocument(UUID agencyId, ComplianceType type,
                                    ComplianceDocumentState.PendingReview state, Instant at);

    AgencyCompliance save(AgencyCompliance row);
}
