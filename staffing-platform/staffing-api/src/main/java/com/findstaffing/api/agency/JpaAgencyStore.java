package com.findstaffing.api.agency;

import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.repository.AgencyRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Component
public class JpaAgencyStore implements AgencyStore {

    private final AgencyRepository repository;

    public JpaAgencyStore(AgencyRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Agency> find(UUID agencyId) {
        return repository.findById(agencyId);
    }

    @Override
    @Transactional
    public Agency save(Agency agency) {
        return repository.save(agency);
    }
}
