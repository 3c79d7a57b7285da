package com.findstaffing.api.agency;

import com.findstaffing.core.domain.Agency;

import java.util.Optional;
import java.util.UUID;

public interface AgencyStore {

    Optional<Agency> find(UUID agencyId);

    Agency save(Agency agency);
}
