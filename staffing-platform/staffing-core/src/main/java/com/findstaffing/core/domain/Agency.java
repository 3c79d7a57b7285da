package com.findstaffing.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Agency - aggregate root of the staffing directory.
 *
 * Identity is immutable. The audit fields {@code lastEditedAt}/{@code lastEditedBy}
 * are only written through {@link #markEdited(UUID, Instant)}, which the admin
 * services call after a successful mutation.
 */
@Entity
@Table(name = "agencies", indexes = {
    @Index(name = "idx_agency_slug", columnList = "slug"),
    @Index(name = "idx_agency_claimed_by", columnList = "claimed_by")
})
public class Agency {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @NotNull
    @Column(name = "slug", nullable = false, unique = true)
    private String slug;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "website")
    private String website;

    @Column(name = "phone")
    private String phone;

    @Column(name = "email")
    private String email;

    @Column(name = "headquarters", length = 200)
    private String headquarters;

    @Column(name = "founded_year")
    private Integer foundedYear;

    @Enumerated(EnumType.STRING)
    @Column(name = "employee_count")
    private EmployeeCount employeeCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "company_size")
    private CompanySize companySize;

    @Column(name = "offers_per_diem", nullable = false)
    private boolean offersPerDiem;

    @Column(name = "is_union", nullable = false)
    private boolean union;

    @Column(name = "claimed_by")
    private UUID claimedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "last_edited_at")
    private Instant lastEditedAt;

    @Column(name = "last_edited_by")
    private UUID lastEditedBy;

    /**
     * Head-count bands shown on the public profile.
     */
    public enum EmployeeCount {
        RANGE_1_10("1-10"),
        RANGE_11_50("11-50"),
        RANGE_51_100("51-100"),
        RANGE_101_200("101-200"),
        RANGE_201_500("201-500"),
        RANGE_501_1000("501-1000"),
        RANGE_1001_PLUS("1001+");

        private final String label;

        EmployeeCount(String label) {
            this.label = label;
        }

        public String label() { return label; }

        public static EmployeeCount fromLabel(String label) {
            for (EmployeeCount value : values()) {
                if (value.label.equals(label)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown employee count: " + label);
        }
    }

    public enum CompanySize {
        SMALL("Small"),
        MEDIUM("Medium"),
        LARGE("Large"),
        ENTERPRISE("Enterprise");

        private final String label;

        CompanySize(String label) {
            this.label = label;
        }

        public String label() { return label; }

        public static CompanySize fromLabel(String label) {
            for (CompanySize value : values()) {
                if (value.label.equals(label)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown company size: " + label);
        }
    }

    protected Agency() {}

    /**
     * Creates a new unclaimed agency listing.
     */
    public static Agency create(String name, String slug) {
        Agency agency = new Agency();
        agency.id = UUID.randomUUID();
        agency.name = name;
        agency.slug = slug;
        agency.createdAt = Instant.now();
        agency.updatedAt = agency.createdAt;
        return agency;
    }

    /**
     * Records the editor and time of a successful administrative mutation.
     */
    public void markEdited(UUID editorId, Instant at) {
        this.lastEditedAt = at;
        this.lastEditedBy = editorId;
        this.updatedAt = at;
    }

    /**
     * Detached copy carrying the same identity and fields, stamped as edited.
     * The receiver is left untouched.
     */
    public Agency editedCopy(UUID editorId, Instant at) {
        Agency copy = new Agency();
        copy.id = id;
        copy.name = name;
        copy.slug = slug;
        copy.description = description;
        copy.website = website;
        copy.phone = phone;
        copy.email = email;
        copy.headquarters = headquarters;
        copy.foundedYear = foundedYear;
        copy.employeeCount = employeeCount;
        copy.companySize = companySize;
        copy.offersPerDiem = offersPerDiem;
        copy.union = union;
        copy.claimedBy = claimedBy;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.lastEditedAt = lastEditedAt;
        copy.lastEditedBy = lastEditedBy;
        copy.markEdited(editorId, at);
        return copy;
    }

    public void claim(UUID ownerId) {
        if (this.claimedBy != null && !this.claimedBy.equals(ownerId)) {
            throw new IllegalStateException("Agency already claimed");
        }
        this.claimedBy = ownerId;
    }

    public boolean isClaimed() {
        return claimedBy != null;
    }

    // Getters
    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getSlug() { return slug; }
    public String getDescription() { return description; }
    public String getWebsite() { return website; }
    public String getPhone() { return phone; }
    public String getEmail() { return email; }
    public String getHeadquarters() { return headquarters; }
    public Integer getFoundedYear() { return foundedYear; }
    public EmployeeCount getEmployeeCount() { return employeeCount; }
    public CompanySize getCompanySize() { return companySize; }
    public boolean isOffersPerDiem() { return offersPerDiem; }
    public boolean isUnion() { return union; }
    public UUID getClaimedBy() { return claimedBy; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getLastEditedAt() { return lastEditedAt; }
    public UUID getLastEditedBy() { return lastEditedBy; }

    // Setters for editable scalar fields
    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Agency name is required");
        }
        this.name = name;
    }

    public void setDescription(String description) { this.description = description; }
    public void setWebsite(String website) { this.website = website; }
    public void setPhone(String phone) { this.phone = phone; }
    public void setEmail(String email) { this.email = email; }
    public void setHeadquarters(String headquarters) { this.headquarters = headquarters; }
    public void setFoundedYear(Integer foundedYear) { this.foundedYear = foundedYear; }
    public void setEmployeeCount(EmployeeCount employeeCount) { this.employeeCount = employeeCount; }
    public void setCompanySize(CompanySize companySize) { this.companySize = companySize; }
    public void setOffersPerDiem(boolean offersPerDiem) { this.offersPerDiem = offersPerDiem; }
    public void setUnion(boolean union) { this.union = union; }
}
