package com.findstaffing.api.compliance;

import com.findstaffing.api.agency.AgencyStore;
import com.findstaffing.api.agency.ProfileDirectory;
import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.config.StaffingProperties;
import com.findstaffing.api.error.ErrorKind;
import com.findstaffing.api.error.NotFoundException;
import com.findstaffing.api.error.StoreException;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.api.notify.ComplianceRejectionEmail;
import com.findstaffing.api.notify.NotificationDispatcher;
import com.findstaffing.api.step.Step;
import com.findstaffing.api.step.StepReport;
import com.findstaffing.api.step.StepRunner;
import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceDocumentState;
import com.findstaffing.core.domain.ComplianceDocumentState.IllegalTransitionException;
import com.findstaffing.core.domain.ComplianceType;
import com.findstaffing.core.domain.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Drives a compliance document through upload, verification, rejection and removal.
 *
 * Uploads store the object first and only then point the status row at it;
 * a failure after the object was stored removes it again. Rejections commit the
 * cleared status row first; removing the object and emailing the owner are
 * best-effort and never change the outcome.
 */
@Service
public class ComplianceDocumentService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceDocumentService.class);

    static final Set<String> ACCEPTED_CONTENT_TYPES = Set.of("application/pdf", "image/png", "image/jpeg");
    static final int MIN_REJECTION_REASON_LENGTH = 10;

    static final String REMOVE_PREVIOUS = "remove-previous-document";
    static final String STORE_DOCUMENT = "store-document";
    static final String SIGN_URL = "sign-document-url";
    static final String UPSERT_STATUS = "upsert-compliance-status";
    static final String SAVE_STATUS = "save-compliance-status";
    static final String REMOVE_DOCUMENT = "remove-document";
    static final String NOTIFY_OWNER = "notify-owner";

    private final AgencyStore agencyStore;
    private final ComplianceStore complianceStore;
    private final DocumentStorage documentStorage;
    private final ProfileDirectory profiles;
    private final NotificationDispatcher notifications;
    private final StepRunner stepRunner;
    private final StaffingProperties properties;
    private final Clock clock;

    public ComplianceDocumentService(AgencyStore agencyStore,
                                     ComplianceStore complianceStore,
                                     DocumentStorage documentStorage,
                                     ProfileDirectory profiles,
                                     NotificationDispatcher notifications,
                                     StepRunner stepRunner,
                                     StaffingProperties properties,
                                     Clock clock) {
        this.agencyStore = agencyStore;
        this.complianceStore = complianceStore;
        this.documentStorage = documentStorage;
        this.profiles = profiles;
        this.notifications = notifications;
        this.stepRunner = stepRunner;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stores a new document for (agency, type) and returns its signed URL.
     * Any previous document of that type is removed and the row goes back to
     * pending review.
     */
    public String upload(UUID agencyId, String complianceType, UploadedDocument document, CallerIdentity caller) {
        loadAgency(agencyId);
        if (document == null || document.content() == null) {
            throw new ValidationException("No file provided");
        }
        ComplianceType type = parseType(complianceType, "Invalid or missing compliance_type");
        if (document.contentType() == null || !ACCEPTED_CONTENT_TYPES.contains(document.contentType())) {
            throw new ValidationException("Invalid file type. Accepted types: PDF, PNG, JPEG");
        }
        if (document.size() > properties.getStorage().getMaxUploadBytes()) {
            throw new ValidationException("File too large. Maximum size is 10MB");
        }

        Optional<AgencyCompliance> existing = findRow(agencyId, type);
        ComplianceDocumentState current = existing.map(AgencyCompliance::state)
                .orElseGet(() -> ComplianceDocumentState.of(null, false, null, null));

        Instant now = clock.instant();
        String newPath = DocumentPaths.objectPath(agencyId, type, now, document.filename(), document.contentType());
        String previousPath = current.hasDocument() ? documentStorage.objectPathOf(current.documentUrl()) : null;
        String[] signedUrl = new String[1];
        Step.Action removeNewObject = () -> documentStorage.remove(List.of(newPath));

        List<Step> steps = new ArrayList<>();
        if (previousPath != null) {
            steps.add(Step.bestEffort(REMOVE_PREVIOUS, () -> documentStorage.remove(List.of(previousPath))));
        }
        steps.add(Step.critical(STORE_DOCUMENT, ErrorKind.STORAGE_ERROR, "Failed to upload document",
                () -> documentStorage.upload(newPath, document.content(), document.contentType())));
        steps.add(Step.critical(SIGN_URL, ErrorKind.STORAGE_ERROR, "Failed to generate document URL",
                () -> signedUrl[0] = documentStorage.createSignedUrl(newPath, properties.getStorage().getSignedUrlTtl()))
                .compensatedBy(removeNewObject));
        steps.add(Step.critical(UPSERT_STATUS, ErrorKind.DATABASE_ERROR, "Failed to update compliance record", () -> {
            ComplianceDocumentState next = current.upload(signedUrl[0]);
            complianceStore.upsertDocument(agencyId, type, (ComplianceDocumentState.PendingReview) next, now);
        }).compensatedBy(removeNewObject));

        stepRunner.run("upload " + type.wireValue() + " for agency " + agencyId, steps);

        log.info("Compliance document {} uploaded for agency {} by {} (replaced: {})",
                type.wireValue(), agencyId, caller.userId(), previousPath != null);
        return signedUrl[0];
    }

    /**
     * Marks the current document verified by the caller. Notes replace the
     * existing notes only when non-blank.
     */
    public ReviewOutcome verify(UUID agencyId, String complianceType, String notes, CallerIdentity caller) {
        ComplianceType type = parseType(complianceType, null);
        loadAgency(agencyId);
        AgencyCompliance row = requireRow(agencyId, type);

        Instant now = clock.instant();
        ComplianceDocumentState next = transition(() -> row.state().verify(caller.userId(), now));
        row.apply(next, now);
        String trimmedNotes = trimToNull(notes);
        if (trimmedNotes != null) {
            row.setNotes(trimmedNotes);
        }

        AgencyCompliance saved = save(row, "Failed to verify compliance document");
        log.info("Compliance {} of agency {} verified by {}", type.wireValue(), agencyId, caller.userId());
        return new ReviewOutcome(saved, false, "Compliance document verified successfully");
    }

    /**
     * Rejects the current document: the row loses its document and verification,
     * then the stored object is removed and the agency owner is emailed, both
     * best-effort.
     */
    public ReviewOutcome reject(UUID agencyId, String complianceType, String reason, String notes,
                                CallerIdentity caller) {
        ComplianceType type = parseType(complianceType, null);
        String trimmedReason = requireRejectionReason(reason);
        Agency agency = loadAgency(agencyId);
        AgencyCompliance row = requireRow(agencyId, type);

        Instant now = clock.instant();
        ComplianceDocumentState current = row.state();
        ComplianceDocumentState next = transition(current::reject);
        String rejectedPath = documentStorage.objectPathOf(current.documentUrl());

        row.apply(next, now);
        row.setNotes(trimToNull(notes));
        AgencyCompliance[] saved = new AgencyCompliance[1];
        boolean[] notified = new boolean[1];

        List<Step> steps = new ArrayList<>();
        steps.add(Step.critical(SAVE_STATUS, ErrorKind.DATABASE_ERROR, "Failed to reject compliance document",
                () -> saved[0] = complianceStore.save(row)));
        if (rejectedPath != null) {
            steps.add(Step.bestEffort(REMOVE_DOCUMENT, () -> documentStorage.remove(List.of(rejectedPath))));
        }
        steps.add(Step.bestEffort(NOTIFY_OWNER, () -> notified[0] = notifyOwner(agency, type, trimmedReason)));

        StepReport report = stepRunner.run("reject " + type.wireValue() + " for agency " + agencyId, steps);

        boolean emailSent = notified[0] && report.succeeded(NOTIFY_OWNER);
        log.info("Compliance {} of agency {} rejected by {} (owner notified: {})",
                type.wireValue(), agencyId, caller.userId(), emailSent);
        String message = "Compliance document rejected successfully."
                + (emailSent ? " Agency owner has been notified." : "");
        return new ReviewOutcome(saved[0], emailSent, message);
    }

    /**
     * Deletes the stored document of (agency, type). Verification goes with it;
     * the active flag and notes stay. A type with no row has nothing to remove
     * and succeeds with an empty result.
     */
    public Optional<AgencyCompliance> removeDocument(UUID agencyId, String complianceType, CallerIdentity caller) {
        ComplianceType type = parseType(complianceType, "Invalid or missing compliance_type");
        loadAgency(agencyId);
        Optional<AgencyCompliance> existing = findRow(agencyId, type);
        if (existing.isEmpty()) {
            log.info("No compliance {} record for agency {}; nothing to remove", type.wireValue(), agencyId);
            return Optional.empty();
        }
        AgencyCompliance row = existing.get();

        Instant now = clock.instant();
        ComplianceDocumentState current = row.state();
        String path = current.hasDocument() ? documentStorage.objectPathOf(current.documentUrl()) : null;
        row.apply(current.removeDocument(), now);
        AgencyCompliance[] saved = new AgencyCompliance[1];

        List<Step> steps = new ArrayList<>();
        if (path != null) {
            steps.add(Step.bestEffort(REMOVE_DOCUMENT, () -> documentStorage.remove(List.of(path))));
        }
        steps.add(Step.critical(SAVE_STATUS, ErrorKind.DATABASE_ERROR, "Failed to update compliance record",
                () -> saved[0] = complianceStore.save(row)));

        stepRunner.run("remove " + type.wireValue() + " for agency " + agencyId, steps);

        log.info("Compliance document {} of agency {} removed by {}", type.wireValue(), agencyId, caller.userId());
        return Optional.of(saved[0]);
    }

    /**
     * Emails the claimed owner. Returns false when there is nobody to notify.
     */
    private boolean notifyOwner(Agency agency, ComplianceType type, String reason) {
        if (!properties.getMail().isEnabled() || !agency.isClaimed()) {
            return false;
        }
        Optional<Profile> owner = profiles.find(agency.getClaimedBy());
        if (owner.isEmpty() || owner.get().getEmail() == null || owner.get().getEmail().isBlank()) {
            log.info("Agency {} owner has no email address; rejection not emailed", agency.getId());
            return false;
        }
        String messageId = notifications.send(ComplianceRejectionEmail.compose(
                owner.get().getEmail(),
                owner.get().getFullName(),
                agency,
                type,
                reason,
                properties.getMail().getSiteUrl()));
        log.info("Rejection of {} emailed to owner of agency {} ({})", type.wireValue(), agency.getId(), messageId);
        return true;
    }

    private static String requireRejectionReason(String reason) {
        if (reason == null) {
            throw new ValidationException("Rejection reason is required when rejecting");
        }
        String trimmed = reason.trim();
        if (trimmed.length() < MIN_REJECTION_REASON_LENGTH) {
            throw new ValidationException("Rejection reason must be at least " + MIN_REJECTION_REASON_LENGTH
                    + " characters (currently " + trimmed.length() + " characters)");
        }
        return trimmed;
    }

    static ComplianceType parseType(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message != null ? message : "Compliance type is required");
        }
        return ComplianceType.fromWireValue(value).orElseThrow(() -> new ValidationException(
                message != null ? message : "Invalid compliance type: " + value));
    }

    private Agency loadAgency(UUID agencyId) {
        Optional<Agency> agency;
        try {
            agency = agencyStore.find(agencyId);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to fetch agency", e);
        }
        return agency.orElseThrow(() -> new NotFoundException("Agency not found"));
    }

    private Optional<AgencyCompliance> findRow(UUID agencyId, ComplianceType type) {
        try {
            return complianceStore.find(agencyId, type);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to fetch compliance record", e);
        }
    }

    private AgencyCompliance requireRow(UUID agencyId, ComplianceType type) {
        return findRow(agencyId, type).orElseThrow(() ->
                new NotFoundException("Compliance record not found for type: " + type.wireValue()));
    }

    private AgencyCompliance save(AgencyCompliance row, String failureMessage) {
        try {
            return complianceStore.save(row);
        } catch (RuntimeException e) {
            throw new StoreException(failureMessage, e);
        }
    }

    private static ComplianceDocumentState transition(Supplier<ComplianceDocumentState> move) {
        try {
            return move.get();
        } catch (IllegalTransitionException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Updated row plus the message shown to the admin. {@code ownerNotified}
     * is only ever true for rejections.
     */
    public record ReviewOutcome(AgencyCompliance compliance, boolean ownerNotified, String message) {}
}
