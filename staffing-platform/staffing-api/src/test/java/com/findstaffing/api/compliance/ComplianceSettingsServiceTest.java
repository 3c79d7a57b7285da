package com.findstaffing.api.compliance;

import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.compliance.ComplianceSettingsService.SettingsItem;
import com.findstaffing.api.error.NotFoundException;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.api.support.InMemoryAgencyStore;
import com.findstaffing.api.support.InMemoryComplianceStore;
import com.findstaffing.api.support.MutableClock;
import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceDocumentState;
import com.findstaffing.core.domain.ComplianceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class ComplianceSettingsServiceTest {

    private InMemoryAgencyStore agencies;
    private InMemoryComplianceStore compliance;
    private MutableClock clock;
    private ComplianceSettingsService service;
    private Agency agency;
    private final CallerIdentity admin = new CallerIdentity(UUID.randomUUID(), "admin");

    @BeforeEach
    void setUp() {
        agencies = new InMemoryAgencyStore();
        compliance = new InMemoryComplianceStore();
        clock = new MutableClock(Instant.parse("2025-04-10T08:00:00Z"));
        service = new ComplianceSettingsService(agencies, compliance, clock);
        agency = agencies.add(Agency.create("Gulf Coast Trades", "gulf-coast-trades"));
    }

    @Test
    void update_createsMissingRowsAndReturnsFullList() {
        List<AgencyCompliance> rows = service.update(agency.getId(), List.of(
                new SettingsItem("osha_certified", true, "2026-03-31", "  Card #1182  "),
                new SettingsItem("bonding", false, null, "")), admin);

        assertThat(rows).extracting(AgencyCompliance::getComplianceType)
                .containsExactly("bonding", "osha_certified");
        AgencyCompliance osha = compliance.find(agency.getId(), ComplianceType.OSHA_CERTIFIED).orElseThrow();
        assertThat(osha.isActive()).isTrue();
        assertThat(osha.getExpirationDate()).isEqualTo(LocalDate.of(2026, 3, 31));
        assertThat(osha.getNotes()).isEqualTo("Card #1182");
        AgencyCompliance bonding = compliance.find(agency.getId(), ComplianceType.BONDING).orElseThrow();
        assertThat(bonding.isActive()).isFalse();
        assertThat(bonding.getNotes()).isNull();
    }

    @Test
    void update_neverTouchesDocumentOrVerification() {
        AgencyCompliance row = compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.GENERAL_LIABILITY, clock.instant()));
        UUID verifier = UUID.randomUUID();
        row.apply(new ComplianceDocumentState.PendingReview("https://files.example/compliance-documents/a.pdf")
                .verify(verifier, clock.instant()), clock.instant());

        service.update(agency.getId(), List.of(new SettingsItem("general_liability", false, null, null)), admin);

        AgencyCompliance updated = compliance.find(agency.getId(), ComplianceType.GENERAL_LIABILITY).orElseThrow();
        assertThat(updated.isActive()).isFalse();
        assertThat(updated.isVerified()).isTrue();
        assertThat(updated.getVerifiedBy()).isEqualTo(verifier);
        assertThat(updated.getDocumentUrl()).isEqualTo("https://files.example/compliance-documents/a.pdf");
    }

    @Test
    void update_validatesEveryItemBeforeWriting() {
        List<SettingsItem> items = Arrays.asList(
                new SettingsItem("drug_testing", true, null, null),
                new SettingsItem("forklift", true, null, null),
                new SettingsItem("bonding", null, "31/12/2025", null),
                null);

        assertThatThrownBy(() -> service.update(agency.getId(), items, admin))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Invalid compliance data");
                    assertThat(e.getDetails()).containsOnlyKeys(
                            "items[1].type", "items[2].isActive", "items[2].expirationDate", "items[3]");
                });
        assertThat(compliance.size()).isZero();
    }

    @Test
    void update_requiresItemsArray() {
        assertThatThrownBy(() -> service.update(agency.getId(), null, admin))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Request body must include an items array");
    }

    @Test
    void list_unknownAgency_isNotFound() {
        assertThatThrownBy(() -> service.list(UUID.randomUUID()))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Agency not found");
    }
}
