package com.findstaffing.api.agency;

import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.error.NotFoundException;
import com.findstaffing.api.error.StoreException;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.api.reconcile.ProfileEditLog;
import com.findstaffing.api.reconcile.ReferenceEntity;
import com.findstaffing.api.reconcile.RelationKind;
import com.findstaffing.api.reconcile.RelationReconciler;
import com.findstaffing.api.reconcile.RelationReconciler.Admission;
import com.findstaffing.api.reconcile.RelationReconciler.ReconciliationResult;
import com.findstaffing.api.step.Step;
import com.findstaffing.api.step.StepRunner;
import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.domain.AgencyProfileEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies an admin edit of an agency: scalar fields plus trade and region
 * memberships in one request.
 *
 * Every relation in the request is admitted before anything is written, so an
 * unknown region id leaves the scalar fields and the trades untouched. When the
 * relations are the only change, the agency's last-edited stamp is refreshed
 * best-effort afterwards.
 */
@Service
public class AgencyEditService {

    private static final Logger log = LoggerFactory.getLogger(AgencyEditService.class);

    private final AgencyStore agencyStore;
    private final RelationReconciler reconciler;
    private final ProfileEditLog editLog;
    private final StepRunner stepRunner;
    private final Clock clock;

    public AgencyEditService(AgencyStore agencyStore,
                             RelationReconciler reconciler,
                             ProfileEditLog editLog,
                             StepRunner stepRunner,
                             Clock clock) {
        this.agencyStore = agencyStore;
        this.reconciler = reconciler;
        this.editLog = editLog;
        this.stepRunner = stepRunner;
        this.clock = clock;
    }

    public AgencyEditResult edit(UUID agencyId, Map<String, Object> body, CallerIdentity caller) {
        return edit(agencyId, AgencyEditCommand.parse(body, Year.now(clock).getValue()), caller);
    }

    public AgencyEditResult edit(UUID agencyId, AgencyEditCommand command, CallerIdentity caller) {
        if (command.isEmpty()) {
            throw new ValidationException("No fields provided to update");
        }

        Agency agency = loadAgency(agencyId);

        Map<RelationKind, Admission> admissions = new EnumMap<>(RelationKind.class);
        for (RelationKind kind : RelationKind.values()) {
            command.desiredIds(kind).ifPresent(ids -> admissions.put(kind, reconciler.admit(kind, ids)));
        }

        Agency[] result = {agency};
        if (command.hasScalarChanges()) {
            command.applyTo(agency);
            agency.markEdited(caller.userId(), clock.instant());
            try {
                result[0] = agencyStore.save(agency);
            } catch (RuntimeException e) {
                throw new StoreException("Failed to update agency", e);
            }
        }

        Map<RelationKind, ReconciliationResult> reconciled = new EnumMap<>(RelationKind.class);
        admissions.forEach((kind, admission) ->
                reconciled.put(kind, reconciler.apply(agencyId, admission, caller.userId())));

        if (!command.hasScalarChanges()) {
            // The response keeps the loaded agency unless the stamped copy is stored.
            stepRunner.run("touch agency " + agencyId, List.of(Step.bestEffort("mark-edited",
                    () -> result[0] = agencyStore.save(agency.editedCopy(caller.userId(), clock.instant())))));
        }

        log.info("Agency {} edited by {}: fields={}, relations={}",
                agencyId, caller.userId(), command.scalarChanges().keySet(), reconciled.keySet());

        return new AgencyEditResult(
                result[0],
                members(reconciled.get(RelationKind.TRADES)),
                members(reconciled.get(RelationKind.REGIONS)));
    }

    /**
     * Profile edit history of an agency, newest first.
     */
    public List<AgencyProfileEdit> history(UUID agencyId) {
        loadAgency(agencyId);
        try {
            return editLog.history(agencyId);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to fetch edit history", e);
        }
    }

    private Agency loadAgency(UUID agencyId) {
        try {
            return agencyStore.find(agencyId)
                    .orElseThrow(() -> new NotFoundException("Agency not found"));
        } catch (NotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Failed to fetch agency", e);
        }
    }

    private static List<ReferenceEntity> members(ReconciliationResult result) {
        return result == null ? null : result.members();
    }

    /**
     * Updated agency plus the resulting membership of each relation that was
     * part of the request; a relation not in the request is null.
     */
    public record AgencyEditResult(Agency agency, List<ReferenceEntity> trades, List<ReferenceEntity> regions) {}
}
