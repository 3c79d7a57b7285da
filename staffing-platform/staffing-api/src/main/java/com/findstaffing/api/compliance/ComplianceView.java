package com.findstaffing.api.compliance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Wire form of a compliance status row.
 */
public record ComplianceView(
        UUID id,
        @JsonProperty("agency_id") UUID agencyId,
        @JsonProperty("compliance_type") String complianceType,
        @JsonProperty("display_name") String displayName,
        String state,
        @JsonProperty("document_url") String documentUrl,
        @JsonProperty("is_verified") boolean verified,
        @JsonProperty("verified_by") UUID verifiedBy,
        @JsonProperty("verified_at") Instant verifiedAt,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("expiration_date") LocalDate expirationDate,
        String notes,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public static ComplianceView from(AgencyCompliance row) {
        ComplianceType type = row.getType();
        return new ComplianceView(
                row.getId(),
                row.getAgencyId(),
                type.wireValue(),
                type.displayName(),
                row.state().name(),
                row.getDocumentUrl(),
                row.isVerified(),
                row.getVerifiedBy(),
                row.getVerifiedAt(),
                row.isActive(),
                row.getExpirationDate(),
                row.getNotes(),
                row.getUpdatedAt());
    }
}
