package com.findstaffing.api.agency;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.findstaffing.core.domain.Agency;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire form of an agency in admin responses.
 */
public record AgencyView(
        UUID id,
        String name,
        String slug,
        String description,
        String website,
        String phone,
        String email,
        String headquarters,
        @JsonProperty("founded_year") Integer foundedYear,
        @JsonProperty("employee_count") String employeeCount,
        @JsonProperty("company_size") String companySize,
        @JsonProperty("offers_per_diem") boolean offersPerDiem,
        @JsonProperty("is_union") boolean union,
        @JsonProperty("is_claimed") boolean claimed,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("last_edited_at") Instant lastEditedAt,
        @JsonProperty("last_edited_by") UUID lastEditedBy
) {

    public static AgencyView from(Agency agency) {
        return new AgencyView(
                agency.getId(),
                agency.getName(),
                agency.getSlug(),
                agency.getDescription(),
                agency.getWebsite(),
                agency.getPhone(),
                agency.getEmail(),
                agency.getHeadquarters(),
                agency.getFoundedYear(),
                agency.getEmployeeCount() == null ? null : agency.getEmployeeCount().label(),
                agency.getCompanySize() == null ? null : agency.getCompanySize().label(),
                agency.isOffersPerDiem(),
                agency.isUnion(),
                agency.isClaimed(),
                agency.getUpdatedAt(),
                agency.getLastEditedAt(),
                agency.getLastEditedBy());
    }
}
