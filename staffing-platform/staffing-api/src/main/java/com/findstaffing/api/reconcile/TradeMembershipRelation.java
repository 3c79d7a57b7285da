package com.findstaffing.api.reconcile;

import com.findstaffing.core.repository.AgencyTradeRepository;
import com.findstaffing.core.repository.TradeRepository;
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
public class TradeMembershipRelation implements MembershipRelation {

    private final TradeRepository tradeRepository;
    private final AgencyTradeRepository agencyTradeRepository;
    private final Clock clock;

    public TradeMembershipRelation(TradeRepository tradeRepository,
                                   AgencyTradeRepository agencyTradeRepository,
                                   Clock clock) {
        this.tradeRepository = tradeRepository;
        this.agencyTradeRepository = agencyTradeRepository;
        this.clock = clock;
    }

    @Override
    public RelationKind kind() {
        return RelationKind.TRADES;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferenceEntity> findReferences(Collection<UUID> ids) {
        return tradeRepository.findByIdIn(ids).stream().map(ReferenceEntity::of).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReferenceEntity> findReferencesOrderedByName(Collection<UUID> ids) {
        return tradeRepository.findByIdInOrderByNameAsc(ids).stream().map(ReferenceEntity::of).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<UUID> findMemberIds(UUID agencyId) {
        return new HashSet<>(agencyTradeRepository.findTradeIds(agencyId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findMemberNames(UUID agencyId) {
        return agencyTradeRepository.findTradeNames(agencyId);
    }

    @Override
    @Transactional
    public void upsertMembers(UUID agencyId, Collection<UUID> referenceIds) {
        Instant now = clock.instant();
        for (UUID tradeId : referenceIds) {
            agencyTradeRepository.upsert(agencyId, tradeId, now);
        }
    }

    @Override
    @Transactional
    public void deleteMembers(UUID agencyId, Collection<UUID> referenceIds) {
        agencyTradeRepository.deleteMemberships(agencyId, referenceIds);
    }
}
