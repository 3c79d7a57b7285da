package com.findstaffing.api.compliance;

import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.compliance.ComplianceDocumentService.ReviewOutcome;
import com.findstaffing.api.config.StaffingProperties;
import com.findstaffing.api.error.NotFoundException;
import com.findstaffing.api.error.StorageException;
import com.findstaffing.api.error.StoreException;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.api.notify.EmailMessage;
import com.findstaffing.api.step.StepRunner;
import com.findstaffing.api.support.InMemoryAgencyStore;
import com.findstaffing.api.support.InMemoryComplianceStore;
import com.findstaffing.api.support.InMemoryProfileDirectory;
import com.findstaffing.api.support.MutableClock;
import com.findstaffing.api.support.RecordingDocumentStorage;
import com.findstaffing.api.support.RecordingNotificationDispatcher;
import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceType;
import com.findstaffing.core.domain.Profile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Document lifecycle of agency compliance: upload, verify, reject and remove.
 */
class ComplianceDocumentServiceTest {

    private static final String OSHA = "osha_certified";

    private InMemoryAgencyStore agencies;
    private InMemoryComplianceStore compliance;
    private RecordingDocumentStorage storage;
    private InMemoryProfileDirectory profiles;
    private RecordingNotificationDispatcher notifications;
    private MutableClock clock;
    private StaffingProperties properties;
    private ComplianceDocumentService service;

    private Agency agency;
    private Profile owner;
    private CallerIdentity admin;

    @BeforeEach
    void setUp() {
        agencies = new InMemoryAgencyStore();
        compliance = new InMemoryComplianceStore();
        storage = new RecordingDocumentStorage();
        profiles = new InMemoryProfileDirectory();
        notifications = new RecordingNotificationDispatcher();
        clock = new MutableClock(Instant.parse("2025-06-02T09:30:00Z"));
        properties = new StaffingProperties();
        service = new ComplianceDocumentService(agencies, compliance, storage, profiles, notifications,
                new StepRunner(), properties, clock);

        owner = profiles.add(Profile.create(UUID.randomUUID(), "owner@acme.example", "Dana Owner", "agency_owner"));
        agency = agencies.add(Agency.create("Acme Staffing", "acme-staffing"));
        agency.claim(owner.getId());
        admin = new CallerIdentity(profiles.addAdmin().getId(), Profile.ADMIN_ROLE);
    }

    // ==================== Upload ====================

    @Test
    void upload_firstDocument_createsPendingInactiveRow() {
        // When
        String url = service.upload(agency.getId(), OSHA, pdf("certificate.PDF"), admin);

        // Then
        String expectedPath = agency.getId() + "/osha_certified/" + clock.instant().toEpochMilli() + ".pdf";
        assertThat(storage.objects).containsOnlyKeys(expectedPath);
        assertThat(url).contains("/compliance-documents/" + expectedPath);
        assertThat(storage.signedTtls).containsExactly(Duration.ofDays(7));

        AgencyCompliance row = row(ComplianceType.OSHA_CERTIFIED);
        assertThat(row.getDocumentUrl()).isEqualTo(url);
        assertThat(row.state().name()).isEqualTo("PENDING_REVIEW");
        assertThat(row.isVerified()).isFalse();
        assertThat(row.isActive()).isFalse();
    }

    @Test
    void upload_replacesPreviousDocumentAndResetsVerification() {
        // Given
        String firstUrl = service.upload(agency.getId(), OSHA, pdf("first.pdf"), admin);
        String firstPath = storage.objectPathOf(firstUrl);
        service.verify(agency.getId(), OSHA, null, admin);
        clock.advance(Duration.ofMinutes(5));

        // When
        String secondUrl = service.upload(agency.getId(), OSHA, png("second.png"), admin);

        // Then
        assertThat(compliance.size()).isEqualTo(1);
        assertThat(storage.removed).containsExactly(firstPath);
        assertThat(storage.objects).containsOnlyKeys(storage.objectPathOf(secondUrl));
        AgencyCompliance row = row(ComplianceType.OSHA_CERTIFIED);
        assertThat(row.getDocumentUrl()).isEqualTo(secondUrl);
        assertThat(row.isVerified()).isFalse();
        assertThat(row.getVerifiedBy()).isNull();
        assertThat(row.getVerifiedAt()).isNull();
    }

    @Test
    void upload_preservesSettingsOfExistingRow() {
        AgencyCompliance existing = compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.BONDING, clock.instant()));
        existing.updateSettings(true, LocalDate.of(2026, 1, 31), "Bond on file", clock.instant());

        service.upload(agency.getId(), "bonding", pdf("bond.pdf"), admin);

        AgencyCompliance row = row(ComplianceType.BONDING);
        assertThat(row.isActive()).isTrue();
        assertThat(row.getExpirationDate()).isEqualTo(LocalDate.of(2026, 1, 31));
        assertThat(row.getNotes()).isEqualTo("Bond on file");
    }

    @Test
    void upload_refusesBadInputBeforeStoringAnything() {
        assertThatThrownBy(() -> service.upload(UUID.randomUUID(), OSHA, pdf("a.pdf"), admin))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Agency not found");
        assertThatThrownBy(() -> service.upload(agency.getId(), OSHA, null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No file provided");
        assertThatThrownBy(() -> service.upload(agency.getId(), "forklift", pdf("a.pdf"), admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid or missing compliance_type");
        assertThatThrownBy(() -> service.upload(agency.getId(), null, pdf("a.pdf"), admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid or missing compliance_type");
        assertThatThrownBy(() -> service.upload(agency.getId(), OSHA,
                new UploadedDocument("notes.txt", "text/plain", bytes("hello")), admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid file type. Accepted types: PDF, PNG, JPEG");

        assertThat(storage.objects).isEmpty();
        assertThat(compliance.size()).isZero();
    }

    @Test
    void upload_refusesOversizedFile() {
        properties.getStorage().setMaxUploadBytes(8);

        assertThatThrownBy(() -> service.upload(agency.getId(), OSHA,
                new UploadedDocument("big.pdf", "application/pdf", new byte[9]), admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("File too large. Maximum size is 10MB");
        assertThat(storage.objects).isEmpty();
    }

    @Test
    void upload_storeFailure_leavesRowUntouched() {
        storage.failUpload = true;

        assertThatThrownBy(() -> service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin))
                .isInstanceOf(StorageException.class)
                .hasMessage("Failed to upload document");
        assertThat(compliance.size()).isZero();
    }

    @Test
    void upload_signingFailure_removesStoredObject() {
        storage.failSign = true;

        assertThatThrownBy(() -> service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin))
                .isInstanceOf(StorageException.class)
                .hasMessage("Failed to generate document URL");
        assertThat(storage.objects).isEmpty();
        assertThat(storage.removed).hasSize(1);
        assertThat(compliance.size()).isZero();
    }

    @Test
    void upload_statusFailure_removesStoredObject() {
        compliance.failUpsert = true;

        assertThatThrownBy(() -> service.upload(agency.getId(), OSHA, jpeg("scan.jpeg"), admin))
                .isInstanceOf(StoreException.class)
                .hasMessage("Failed to update compliance record");
        assertThat(storage.objects).isEmpty();
        assertThat(storage.removed).singleElement().asString().endsWith(".jpeg");
    }

    @Test
    void upload_previousDocumentRemovalFailure_isNotFatal() {
        service.upload(agency.getId(), OSHA, pdf("first.pdf"), admin);
        clock.advance(Duration.ofSeconds(1));
        storage.failRemove = true;

        String url = service.upload(agency.getId(), OSHA, pdf("second.pdf"), admin);

        assertThat(row(ComplianceType.OSHA_CERTIFIED).getDocumentUrl()).isEqualTo(url);
    }

    // ==================== Verify ====================

    @Test
    void verify_stampsVerifierAndTime() {
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);
        clock.advance(Duration.ofHours(2));

        ReviewOutcome outcome = service.verify(agency.getId(), OSHA, "  Checked against OSHA registry  ", admin);

        AgencyCompliance row = outcome.compliance();
        assertThat(row.isVerified()).isTrue();
        assertThat(row.getVerifiedBy()).isEqualTo(admin.userId());
        assertThat(row.getVerifiedAt()).isEqualTo(clock.instant());
        assertThat(row.getNotes()).isEqualTo("Checked against OSHA registry");
        assertThat(outcome.ownerNotified()).isFalse();
        assertThat(outcome.message()).isEqualTo("Compliance document verified successfully");
    }

    @Test
    void verify_blankNotesKeepExistingNotes() {
        AgencyCompliance existing = compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.OSHA_CERTIFIED, clock.instant()));
        existing.updateSettings(true, null, "Renewal due in spring", clock.instant());
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);

        service.verify(agency.getId(), OSHA, "   ", admin);

        assertThat(row(ComplianceType.OSHA_CERTIFIED).getNotes()).isEqualTo("Renewal due in spring");
    }

    @Test
    void verify_withoutDocument_isRefused() {
        compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.OSHA_CERTIFIED, clock.instant()));

        assertThatThrownBy(() -> service.verify(agency.getId(), OSHA, null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Cannot verify compliance without a supporting document");
        assertThat(row(ComplianceType.OSHA_CERTIFIED).isVerified()).isFalse();
    }

    @Test
    void verify_missingRow_isNotFound() {
        assertThatThrownBy(() -> service.verify(agency.getId(), OSHA, null, admin))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Compliance record not found for type: osha_certified");
    }

    @Test
    void verify_unknownType_isRefused() {
        assertThatThrownBy(() -> service.verify(agency.getId(), "forklift", null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid compliance type: forklift");
        assertThatThrownBy(() -> service.verify(agency.getId(), " ", null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Compliance type is required");
    }

    // ==================== Reject ====================

    @Test
    void reject_clearsDocumentRemovesObjectAndNotifiesOwner() {
        // Given
        String url = service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);
        String path = storage.objectPathOf(url);
        service.verify(agency.getId(), OSHA, null, admin);

        // When
        ReviewOutcome outcome = service.reject(agency.getId(), OSHA,
                "  Certificate has expired  ", "Expired 2024-12-31", admin);

        // Then
        AgencyCompliance row = outcome.compliance();
        assertThat(row.getDocumentUrl()).isNull();
        assertThat(row.isVerified()).isFalse();
        assertThat(row.getVerifiedBy()).isNull();
        assertThat(row.getNotes()).isEqualTo("Expired 2024-12-31");
        assertThat(storage.removed).containsExactly(path);
        assertThat(outcome.ownerNotified()).isTrue();
        assertThat(outcome.message())
                .isEqualTo("Compliance document rejected successfully. Agency owner has been notified.");

        EmailMessage email = notifications.sent.get(0);
        assertThat(email.to()).isEqualTo("owner@acme.example");
        assertThat(email.subject()).isEqualTo("Compliance Document Update - Acme Staffing");
        assertThat(email.text()).contains("Certificate has expired").contains("OSHA Certified");
    }

    @Test
    void reject_notificationFailure_stillRejects() {
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);
        notifications.fail = true;

        ReviewOutcome outcome = service.reject(agency.getId(), OSHA, "Document is illegible", null, admin);

        assertThat(notifications.attempts).isEqualTo(1);
        assertThat(outcome.ownerNotified()).isFalse();
        assertThat(outcome.message()).isEqualTo("Compliance document rejected successfully.");
        assertThat(row(ComplianceType.OSHA_CERTIFIED).getDocumentUrl()).isNull();
    }

    @Test
    void reject_objectRemovalFailure_stillRejects() {
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);
        storage.failRemove = true;

        ReviewOutcome outcome = service.reject(agency.getId(), OSHA, "Document is illegible", null, admin);

        assertThat(outcome.compliance().getDocumentUrl()).isNull();
        assertThat(outcome.ownerNotified()).isTrue();
    }

    @Test
    void reject_unclaimedAgencyOrDisabledMail_sendsNothing() {
        Agency unclaimed = agencies.add(Agency.create("Unclaimed Labor", "unclaimed-labor"));
        service.upload(unclaimed.getId(), OSHA, pdf("a.pdf"), admin);
        ReviewOutcome unclaimedOutcome = service.reject(unclaimed.getId(), OSHA, "Wrong company name", null, admin);

        properties.getMail().setEnabled(false);
        service.upload(agency.getId(), OSHA, pdf("b.pdf"), admin);
        ReviewOutcome disabledOutcome = service.reject(agency.getId(), OSHA, "Wrong company name", null, admin);

        assertThat(notifications.attempts).isZero();
        assertThat(unclaimedOutcome.ownerNotified()).isFalse();
        assertThat(disabledOutcome.message()).isEqualTo("Compliance document rejected successfully.");
    }

    @Test
    void reject_ownerWithoutEmail_sendsNothing() {
        Profile silentOwner = profiles.add(Profile.create(UUID.randomUUID(), null, "No Mail", "agency_owner"));
        Agency other = agencies.add(Agency.create("Quiet Crew", "quiet-crew"));
        other.claim(silentOwner.getId());
        service.upload(other.getId(), OSHA, pdf("a.pdf"), admin);

        ReviewOutcome outcome = service.reject(other.getId(), OSHA, "Missing signature page", null, admin);

        assertThat(notifications.attempts).isZero();
        assertThat(outcome.ownerNotified()).isFalse();
    }

    @Test
    void reject_reasonIsRequiredAndLongEnough() {
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);

        assertThatThrownBy(() -> service.reject(agency.getId(), OSHA, null, null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Rejection reason is required when rejecting");
        assertThatThrownBy(() -> service.reject(agency.getId(), OSHA, "   blurry   ", null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Rejection reason must be at least 10 characters (currently 6 characters)");
        assertThat(row(ComplianceType.OSHA_CERTIFIED).getDocumentUrl()).isNotNull();
        assertThat(storage.removed).isEmpty();
    }

    @Test
    void reject_withoutDocument_isRefused() {
        compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.DRUG_TESTING, clock.instant()));

        assertThatThrownBy(() -> service.reject(agency.getId(), "drug_testing", "Policy is outdated", null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("No document to reject");
        assertThat(notifications.attempts).isZero();
    }

    @Test
    void reject_saveFailure_skipsCleanupAndEmail() {
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);
        compliance.failSave = true;

        assertThatThrownBy(() -> service.reject(agency.getId(), OSHA, "Certificate has expired", null, admin))
                .isInstanceOf(StoreException.class)
                .hasMessage("Failed to reject compliance document");
        assertThat(storage.removed).isEmpty();
        assertThat(notifications.attempts).isZero();
    }

    // ==================== Remove ====================

    @Test
    void removeDocument_clearsDocumentAndVerificationButKeepsSettings() {
        AgencyCompliance existing = compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.WORKERS_COMP, clock.instant()));
        existing.updateSettings(true, LocalDate.of(2025, 12, 1), "Policy 44-A", clock.instant());
        String url = service.upload(agency.getId(), "workers_comp", pdf("policy.pdf"), admin);
        service.verify(agency.getId(), "workers_comp", null, admin);

        AgencyCompliance row = service.removeDocument(agency.getId(), "workers_comp", admin).orElseThrow();

        assertThat(row.getDocumentUrl()).isNull();
        assertThat(row.isVerified()).isFalse();
        assertThat(row.state().name()).isEqualTo("NO_DOCUMENT");
        assertThat(row.isActive()).isTrue();
        assertThat(row.getNotes()).isEqualTo("Policy 44-A");
        assertThat(storage.removed).containsExactly(storage.objectPathOf(url));
    }

    @Test
    void removeDocument_withoutDocument_touchesNoStorage() {
        compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.WORKERS_COMP, clock.instant()));

        AgencyCompliance row = service.removeDocument(agency.getId(), "workers_comp", admin).orElseThrow();

        assertThat(row.getDocumentUrl()).isNull();
        assertThat(storage.removed).isEmpty();
    }

    @Test
    void removeDocument_storageFailure_isNotFatal() {
        service.upload(agency.getId(), OSHA, pdf("a.pdf"), admin);
        storage.failRemove = true;

        AgencyCompliance row = service.removeDocument(agency.getId(), OSHA, admin).orElseThrow();

        assertThat(row.getDocumentUrl()).isNull();
        assertThat(compliance.saves).isEqualTo(1);
    }

    @Test
    void removeDocument_missingRow_succeedsWithoutWrites() {
        // Given: bonding was never configured for the agency
        assertThat(compliance.find(agency.getId(), ComplianceType.BONDING)).isEmpty();

        // When
        Optional<AgencyCompliance> removed = service.removeDocument(agency.getId(), "bonding", admin);

        // Then
        assertThat(removed).isEmpty();
        assertThat(compliance.saves).isZero();
        assertThat(compliance.size()).isZero();
        assertThat(storage.removed).isEmpty();
    }

    @Test
    void removeDocument_unknownType_isRejected() {
        assertThatThrownBy(() -> service.removeDocument(agency.getId(), "insurance", admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid or missing compliance_type");
    }

    private AgencyCompliance row(ComplianceType type) {
        return compliance.find(agency.getId(), type).orElseThrow();
    }

    private static UploadedDocument pdf(String name) {
        return new UploadedDocument(name, "application/pdf", bytes("%PDF-1.7 test"));
    }

    private static UploadedDocument png(String name) {
        return new UploadedDocument(name, "image/png", bytes("PNG"));
    }

    private static UploadedDocument jpeg(String name) {
        return new UploadedDocument(name, "image/jpeg", bytes("JPEG"));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
