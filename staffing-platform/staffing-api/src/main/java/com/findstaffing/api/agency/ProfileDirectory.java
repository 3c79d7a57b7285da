package com.findstaffing.api.agency;

import com.findstaffing.core.domain.Profile;

import java.util.Optional;
import java.util.UUID;

/**
 * Lookup of user profiles: roles for authorization, contact details for notifications.
 */
public interface ProfileDirectory {

    Optional<Profile> find(UUID profileId);
}
