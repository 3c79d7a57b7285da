package com.findstaffing.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

/**
 * Service region reference row. {@code stateCode} is the two-letter US state.
 */
@Entity
@Table(name = "regions", indexes = {
    @Index(name = "idx_region_name", columnList = "name"),
    @Index(name = "idx_region_state", columnList = "state_code")
})
public class Region {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "name", nullable = false)
    private String name;

    @NotNull
    @Column(name = "slug", nullable = false, unique = true)
    private String slug;

    @NotNull
    @Column(name = "state_code", nullable = false, length = 2)
    private String stateCode;

    protected Region() {}

    public Region(UUID id, String name, String slug, String stateCode) {
        this.id = id;
        this.name = name;
        this.slug = slug;
        this.stateCode = stateCode;
    }

    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getSlug() { return slug; }
    public String getStateCode() { return stateCode; }
}
