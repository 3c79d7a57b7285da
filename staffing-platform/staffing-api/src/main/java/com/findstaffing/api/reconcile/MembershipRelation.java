package com.findstaffing.api.reconcile;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Store access for one agency join relation. Implementations throw unchecked
 * exceptions on store failures; callers decide whether a failure is fatal.
 */
public interface MembershipRelation {

    RelationKind kind();

    /**
     * Reference rows whose id is in {@code ids}, in no particular order.
     */
    List<ReferenceEntity> findReferences(Collection<UUID> ids);

    List<ReferenceEntity> findReferencesOrderedByName(Collection<UUID> ids);

    Set<UUID> findMemberIds(UUID agencyId);

    /**
     * Display names of the agency's current members, ordered by name.
     */
    List<String> findMemberNames(UUID agencyId);

    /**
     * Adds memberships; re-adding an existing one is a no-op.
     */
    void upsertMembers(UUID agencyId, Collection<UUID> referenceIds);

    /**
     * Deletes memberships of this agency only.
     */
    void deleteMembers(UUID agencyId, Collection<UUID> referenceIds);
}
