package com.findstaffing.api.agency;

import com.findstaffing.core.domain.Profile;
import com.findstaffing.core.repository.ProfileRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaProfileDirectory implements ProfileDirectory {

    private final ProfileRepository repository;

    public JpaProfileDirectory(ProfileRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Profile> find(UUID profileId) {
        return repository.findById(profileId);
    }
}
