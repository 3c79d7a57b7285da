package com.findstaffing.api.reconcile;

import com.findstaffing.core.domain.AgencyProfileEdit;

import java.util.List;
import java.util.UUID;

/**
 * Append-only log of administrative profile edits.
 */
public interface ProfileEditLog {

    void append(AgencyProfileEdit edit);

    /**
     * Edits of one agency, newest first.
     */
    List<AgencyProfileEdit> history(UUID agencyId);
}
