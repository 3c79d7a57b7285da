package com.findstaffing.api.reconcile;

import com.findstaffing.core.repository.AgencyRegionRepository;
import com.findstaffing.core.repository.RegionRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Component
public class RegionMembershipRelation implements MembershipRelation {

    private final RegionRepository regionRepository;
    private final AgencyRegionRepository agencyRegionRepository;
    private final Clock clock;

    public RegionMembershipRelation(RegionRepository regionRepository,
                                    AgencyRegionRepository agencyRegionRepository,
                                    Clock clock) {
        this.regionRepository = regionRepository;
        this.agencyRegionRepository = agencyRegionRepository;
        this.clock = clock;
    }

    @Override
    public RelationKind kind() {
        return RelationKind.REGIONS;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferenceEntity> findReferences(Collection<UUID> ids) {
        return regionRepository.findByIdIn(ids).stream().map(ReferenceEntity::of).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferenceEntity> findReferencesOrderedByName(Collection<UUID> ids) {
        return regionRepository.findByIdInOrderByNameAsc(ids).stream().map(ReferenceEntity::of).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<UUID> findMemberIds(UUID agencyId) {
        return new HashSet<>(agencyRegionRepository.findRegionIds(agencyId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findMemberNames(UUID agencyId) {
        return agencyRegionRepository.findRegionNames(agencyId);
    }

    @Override
    @Transactional
    public void upsertMembers(UUID agencyId, Collection<UUID> referenceIds) {
        Instant now = clock.instant();
        for (UUID regionId : referenceIds) {
            agencyRegionRepository.upsert(agencyId, regionId, now);
        }
    }

    @Override
    @Transactional
    public void deleteMembers(UUID agencyId, Collection<UUID> referenceIds) {
        agencyRegionRepository.deleteMemberships(agencyId, referenceIds);
    }
}
