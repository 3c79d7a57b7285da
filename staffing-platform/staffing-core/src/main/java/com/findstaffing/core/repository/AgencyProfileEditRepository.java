package com.findstaffing.core.repository;

import com.findstaffing.core.domain.AgencyProfileEdit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for profile edit audit rows.
 * Append-only - no update or delete operations exposed.
 */
@Repository
public interface AgencyProfileEditRepository extends JpaRepository<AgencyProfileEdit, UUID> {

    /**
     * Edit history of an agency, newest first.
     */
    List<AgencyProfileEdit> findByAgencyIdOrderByCreatedAtDesc(UUID agencyId);
}
