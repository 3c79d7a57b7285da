package com.findstaffing.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * User profile. Identity matches the subject of the caller's access token.
 */
@Entity
@Table(name = "profiles")
public class Profile {

    public static final String ADMIN_ROLE = "admin";

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "email")
    private String email;

    @Column(name = "full_name")
    private String fullName;

    @NotNull
    @Column(name = "role", nullable = false, length = 32)
    private String role;

    protected Profile() {}

    public static Profile create(UUID id, String email, String fullName, String role) {
        Profile profile = new Profile();
        profile.id = id;
        profile.email = email;
        profile.fullName = fullName;
        profile.role = role;
        return profile;
    }

    public boolean isAdmin() {
        return ADMIN_ROLE.equals(role);
    }

    public UUID getId() { return id; }
    public String getEmail() { return email; }
    public String getFullName() { return fullName; }
    public String getRole() { return role; }
}
