package com.findstaffing.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Compliance status of one agency for one {@link ComplianceType}.
 *
 * The document and verification columns are written only through
 * {@link #apply(ComplianceDocumentState, Instant)}, so a row can never claim
 * verification for a document it does not hold. The active flag, expiration
 * date and notes are independent settings.
 */
@Entity
@Table(name = "agency_compliance",
    uniqueConstraints = @UniqueConstraint(name = "uq_agency_compliance_type",
        columnNames = {"agency_id", "compliance_type"}),
    indexes = @Index(name = "idx_agency_compliance_agency", columnList = "agency_id"))
public class AgencyCompliance {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "agency_id", nullable = false, updatable = false)
    private UUID agencyId;

    @NotNull
    @Column(name = "compliance_type", nullable = false, updatable = false, length = 50)
    private String complianceType;

    @Column(name = "document_url", columnDefinition = "TEXT")
    private String documentUrl;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "verified_by")
    private UUID verifiedBy;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected AgencyCompliance() {}

    /**
     * New inactive row with no document.
     */
    public static AgencyCompliance create(UUID agencyId, ComplianceType type, Instant at) {
        AgencyCompliance row = new AgencyCompliance();
        row.id = UUID.randomUUID();
        row.agencyId = agencyId;
        row.complianceType = type.wireValue();
        row.createdAt = at;
        row.updatedAt = at;
        return row;
    }

    public ComplianceDocumentState state() {
        return ComplianceDocumentState.of(documentUrl, verified, verifiedBy, verifiedAt);
    }

    /**
     * Writes the document/verification columns from a lifecycle state.
     */
    public void apply(ComplianceDocumentState state, Instant at) {
        this.documentUrl = state.documentUrl();
        if (state instanceof ComplianceDocumentState.Verified v) {
            this.verified = true;
            this.verifiedBy = v.verifiedBy();
            this.verifiedAt = v.verifiedAt();
        } else {
            this.verified = false;
            this.verifiedBy = null;
            this.verifiedAt = null;
        }
        this.updatedAt = at;
    }

    public void updateSettings(boolean active, LocalDate expirationDate, String notes, Instant at) {
        this.active = active;
        this.expirationDate = expirationDate;
        this.notes = notes;
        this.updatedAt = at;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public ComplianceType getType() {
        return ComplianceType.fromWireValue(complianceType)
                .orElseThrow(() -> new IllegalStateException("Unknown compliance type: " + complianceType));
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getAgencyId() { return agencyId; }
    public String getComplianceType() { return complianceType; }
    public String getDocumentUrl() { return documentUrl; }
    public boolean isVerified() { return verified; }
    public UUID getVerifiedBy() { return verifiedBy; }
    public Instant getVerifiedAt() { return verifiedAt; }
    public boolean isActive() { return active; }
    public LocalDate getExpirationDate() { return expirationDate; }
    public String getNotes() { return notes; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
