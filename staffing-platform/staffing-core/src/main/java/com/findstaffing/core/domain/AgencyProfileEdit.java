package com.findstaffing.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable audit entry for an administrative profile edit.
 * Old and new values are the ordered display names of the relation members.
 * Append-only: no setters, never updated or deleted.
 */
@Entity
@Table(name = "agency_profile_edits", indexes = {
    @Index(name = "idx_profile_edit_agency", columnList = "agency_id"),
    @Index(name = "idx_profile_edit_created", columnList = "created_at")
})
public class AgencyProfileEdit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "agency_id", nullable = false, updatable = false)
    private UUID agencyId;

    @NotNull
    @Column(name = "edited_by", nullable = false, updatable = false)
    private UUID editedBy;

    @NotNull
    @Column(name = "field_name", nullable = false, updatable = false)
    private String fieldName;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_value", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<String> oldValue;

    @NotNull
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_value", nullable = false, updatable = false, columnDefinition = "jsonb")
    private List<String> newValue;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected AgencyProfileEdit() {}

    public static AgencyProfileEdit record(
            UUID agencyId,
            UUID editedBy,
            String fieldName,
            List<String> oldValue,
            List<String> newValue,
            Instant at) {

        var edit = new AgencyProfileEdit();
        edit.agencyId = agencyId;
        edit.editedBy = editedBy;
        edit.fieldName = fieldName;
        edit.oldValue = List.copyOf(oldValue);
        edit.newValue = List.copyOf(newValue);
        edit.createdAt = at;
        return edit;
    }

    public UUID getId() { return id; }
    public UUID getAgencyId() { return agencyId; }
    public UUID getEditedBy() { return editedBy; }
    public String getFieldName() { return fieldName; }
    public List<String> getOldValue() { return oldValue; }
    public List<String> getNewValue() { return newValue; }
    public Instant getCreatedAt() { return createdAt; }
}
