package com.findstaffing.api.reconcile;

import com.findstaffing.core.domain.AgencyProfileEdit;
import com.findstaffing.core.repository.AgencyProfileEditRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Component
public class JpaProfileEditLog implements ProfileEditLog {

    private final AgencyProfileEditRepository repository;

    public JpaProfileEditLog(AgencyProfileEditRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void append(AgencyProfileEdit edit) {
        repository.save(edit);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AgencyProfileEdit> history(UUID agencyId) {
        return repository.findByAgencyIdOrderByCreatedAtDesc(agencyId);
    }
}
