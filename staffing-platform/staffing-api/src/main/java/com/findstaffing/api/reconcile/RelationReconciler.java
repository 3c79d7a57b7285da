package com.findstaffing.api.reconcile;

import com.findstaffing.api.error.ErrorKind;
import com.findstaffing.api.error.StoreException;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.api.step.Step;
import com.findstaffing.api.step.StepReport;
import com.findstaffing.api.step.StepRunner;
import com.findstaffing.core.domain.AgencyProfileEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reconciles an agency's membership in a join relation with a desired id set.
 *
 * Two phases: {@link #admit} checks that every desired id exists and writes
 * nothing; {@link #apply} upserts the desired memberships, prunes the orphans,
 * appends one audit row and returns the final membership. Orphan pruning and
 * the audit append are best-effort.
 */
@Service
public class RelationReconciler {

    private static final Logger log = LoggerFactory.getLogger(RelationReconciler.class);

    static final String READ_CURRENT = "read-current-members";
    static final String UPSERT_MEMBERS = "upsert-members";
    static final String DELETE_ORPHANS = "delete-orphans";
    static final String APPEND_AUDIT = "append-audit";
    static final String LOAD_MEMBERS = "load-members";

    private final Map<RelationKind, MembershipRelation> relations = new EnumMap<>(RelationKind.class);
    private final ProfileEditLog editLog;
    private final StepRunner stepRunner;
    private final Clock clock;

    public RelationReconciler(List<MembershipRelation> relations,
                              ProfileEditLog editLog,
                              StepRunner stepRunner,
                              Clock clock) {
        for (MembershipRelation relation : relations) {
            this.relations.put(relation.kind(), relation);
        }
        for (RelationKind kind : RelationKind.values()) {
            if (!this.relations.containsKey(kind)) {
                throw new IllegalStateException("No membership relation registered for " + kind);
            }
        }
        this.editLog = editLog;
        this.stepRunner = stepRunner;
        this.clock = clock;
    }

    /**
     * Admission check. An empty set is admitted without reading anything.
     *
     * @throws ValidationException listing exactly the ids that do not exist
     */
    public Admission admit(RelationKind kind, Collection<UUID> desiredIds) {
        Set<UUID> desired = new LinkedHashSet<>(desiredIds);
        if (desired.isEmpty()) {
            return new Admission(kind, Set.of(), List.of());
        }

        List<ReferenceEntity> found;
        try {
            found = relation(kind).findReferences(desired);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to validate " + kind.noun() + " IDs", e);
        }

        Set<UUID> foundIds = found.stream().map(ReferenceEntity::id).collect(Collectors.toSet());
        List<String> missing = desired.stream()
                .filter(id -> !foundIds.contains(id))
                .map(UUID::toString)
                .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Invalid " + kind.noun() + " IDs provided",
                    Map.of(kind.invalidIdsKey(), missing));
        }
        return new Admission(kind, desired, found);
    }

    public ReconciliationResult apply(UUID agencyId, Admission admission, UUID editorId) {
        RelationKind kind = admission.kind();
        MembershipRelation relation = relation(kind);
        Set<UUID> desired = admission.ids();
        Instant at = clock.instant();
        Pipeline pipeline = new Pipeline();

        List<Step> steps = new ArrayList<>();
        steps.add(Step.critical(READ_CURRENT, ErrorKind.DATABASE_ERROR,
                "Failed to fetch current " + kind.fieldName() + " for audit trail", () -> {
                    pipeline.currentIds = relation.findMemberIds(agencyId);
                    pipeline.currentNames = relation.findMemberNames(agencyId);
                }));
        if (!desired.isEmpty()) {
            steps.add(Step.critical(UPSERT_MEMBERS, ErrorKind.DATABASE_ERROR,
                    "Failed to insert/update " + kind.fieldName(),
                    () -> relation.upsertMembers(agencyId, desired)));
        }
        steps.add(Step.bestEffort(DELETE_ORPHANS, () -> {
            Set<UUID> orphans = new HashSet<>(pipeline.currentIds);
            orphans.removeAll(desired);
            pipeline.removed = orphans.size();
            if (!orphans.isEmpty()) {
                relation.deleteMembers(agencyId, orphans);
            }
        }));
        steps.add(Step.bestEffort(APPEND_AUDIT, () -> editLog.append(AgencyProfileEdit.record(
                agencyId, editorId, kind.fieldName(), pipeline.currentNames, admission.referenceNames(), at))));
        if (!desired.isEmpty()) {
            steps.add(Step.critical(LOAD_MEMBERS, ErrorKind.DATABASE_ERROR,
                    kind.label() + " updated but failed to fetch results",
                    () -> pipeline.members = relation.findReferencesOrderedByName(desired)));
        }

        StepReport report = stepRunner.run("reconcile " + kind.fieldName() + " of agency " + agencyId, steps);

        long added = desired.stream().filter(id -> !pipeline.currentIds.contains(id)).count();
        log.info("Reconciled {} of agency {} by {}: {} desired, {} added, {} orphaned",
                kind.fieldName(), agencyId, editorId, desired.size(), added, pipeline.removed);

        return new ReconciliationResult(kind, pipeline.members, report.succeeded(APPEND_AUDIT), report.warnings());
    }

    public ReconciliationResult reconcile(UUID agencyId, RelationKind kind, Collection<UUID> desiredIds, UUID editorId) {
        return apply(agencyId, admit(kind, desiredIds), editorId);
    }

    private MembershipRelation relation(RelationKind kind) {
        return relations.get(kind);
    }

    /**
     * Values passed from one step to the next within a single apply.
     */
    private static final class Pipeline {
        Set<UUID> currentIds = Set.of();
        List<String> currentNames = List.of();
        List<ReferenceEntity> members = List.of();
        int removed;
    }

    /**
     * Desired membership that passed the existence check.
     */
    public record Admission(RelationKind kind, Set<UUID> ids, List<ReferenceEntity> references) {

        public Admission {
            ids = Set.copyOf(ids);
            references = List.copyOf(references);
        }

        /** Display names of the admitted references, ordered by name. */
        public List<String> referenceNames() {
            return references.stream()
                    .map(ReferenceEntity::name)
                    .sorted(Comparator.naturalOrder())
                    .toList();
        }
    }

    public record ReconciliationResult(
            RelationKind kind,
            List<ReferenceEntity> members,
            boolean auditWritten,
            List<StepReport.Warning> warnings
    ) {}
}
