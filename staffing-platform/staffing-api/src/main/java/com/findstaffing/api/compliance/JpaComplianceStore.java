package com.findstaffing.api.compliance;

import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceDocumentState;
import com.findstaffing.core.domain.ComplianceType;
import com.findstaffing.core.repository.AgencyComplianceRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class JpaComplianceStore implements ComplianceStore {

    private final AgencyComplianceRepository repository;

    public JpaComplianceStore(AgencyComplianceRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AgencyCompliance> find(UUID agencyId, ComplianceType type) {
        return repository.findByAgencyIdAndComplianceType(agencyId, type.wireValue());
    }

    @Override
    @Transactional(readOnly = true)
    public List<AgencyCompliance> findAll(UUID agencyId) {
        return repository.findByAgencyIdOrderByComplianceTypeAsc(agencyId);
    }

    @Override
    @Transactional
    public AgencyCompliance upsertDocument(UUID agencyId, ComplianceType type,
                                           ComplianceDocumentState.PendingReview state, Instant at) {
        repository.upsertDocument(UUID.randomUUID(), agencyId, type.wireValue(), state.documentUrl(), at);
        return repository.findByAgencyIdAndComplianceType(agencyId, type.wireValue())
                .orElseThrow(() -> new IllegalStateException("Compliance row missing after upsert"));
    }

    @Override
    @Transactional
    public AgencyCompliance save(AgencyCompliance row) {
        return repository.save(row);
    }
}
