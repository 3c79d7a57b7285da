package com.findstaffing.api.compliance;

import com.findstaffing.api.auth.AuthorizationGate;
import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.config.StaffingProperties;
import com.findstaffing.api.error.ApiExceptionHandler;
import com.findstaffing.api.error.ForbiddenException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the compliance endpoints.
 */
class AdminComplianceControllerTest {

    private static final String TOKEN = "Bearer admin-token";
    private static final String BASE = "/api/v1/admin/agencies/{id}/compliance";

    private MockMvc mockMvc;
    private InMemoryComplianceStore compliance;
    private RecordingDocumentStorage storage;
    private MutableClock clock;
    private Agency agency;

    @BeforeEach
    void setUp() {
        InMemoryAgencyStore agencies = new InMemoryAgencyStore();
        compliance = new InMemoryComplianceStore();
        storage = new RecordingDocumentStorage();
        clock = new MutableClock(Instant.parse("2025-06-02T09:30:00Z"));
        StepRunner stepRunner = new StepRunner();
        ComplianceDocumentService documentService = new ComplianceDocumentService(agencies, compliance, storage,
                new InMemoryProfileDirectory(), new RecordingNotificationDispatcher(), stepRunner,
                new StaffingProperties(), clock);
        ComplianceSettingsService settingsService = new ComplianceSettingsService(agencies, compliance, clock);

        CallerIdentity admin = new CallerIdentity(UUID.randomUUID(), "admin");
        AuthorizationGate gate = header -> {
            if (!TOKEN.equals(header)) {
                throw new ForbiddenException("Admin access required");
            }
            return admin;
        };

        mockMvc = MockMvcBuilders.standaloneSetup(new AdminComplianceController(gate, documentService, settingsService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();

        agency = agencies.add(Agency.create("Acme Staffing", "acme-staffing"));
    }

    @Test
    void uploadDocument_returnsSignedUrl() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "osha.pdf", "application/pdf", "%PDF".getBytes());

        mockMvc.perform(multipart(BASE + "/document", agency.getId())
                        .file(file)
                        .param("compliance_type", "osha_certified")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.document_url").value(startsWith("https://storage.example.com/")));

        assertThat(compliance.find(agency.getId(), ComplianceType.OSHA_CERTIFIED)).isPresent();
    }

    @Test
    void uploadDocument_withoutFile_isValidationError() throws Exception {
        mockMvc.perform(multipart(BASE + "/document", agency.getId())
                        .param("compliance_type", "osha_certified")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("No file provided"));
    }

    @Test
    void uploadDocument_wrongContentType_isValidationError() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());

        mockMvc.perform(multipart(BASE + "/document", agency.getId())
                        .file(file)
                        .param("compliance_type", "osha_certified")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Invalid file type. Accepted types: PDF, PNG, JPEG"));
    }

    @Test
    void deleteDocument_returnsNullUrl() throws Exception {
        AgencyCompliance row = compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.BONDING, clock.instant()));
        row.apply(row.state().upload("https://storage.example.com/object/sign/compliance-documents/a/bonding/1.pdf"),
                clock.instant());

        mockMvc.perform(delete(BASE + "/document", agency.getId())
                        .param("compliance_type", "bonding")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.document_url").value(nullValue()));

        assertThat(storage.removed).containsExactly("a/bonding/1.pdf");
    }

    @Test
    void deleteDocument_withoutRow_stillSucceeds() throws Exception {
        mockMvc.perform(delete(BASE + "/document", agency.getId())
                        .param("compliance_type", "drug_testing")
                        .header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.document_url").value(nullValue()));

        assertThat(compliance.size()).isZero();
        assertThat(storage.removed).isEmpty();
    }

    @Test
    void review_verifyThenReject() throws Exception {
        AgencyCompliance row = compliance.add(AgencyCompliance.create(agency.getId(), ComplianceType.OSHA_CERTIFIED, clock.instant()));
        row.apply(row.state().upload("https://storage.example.com/object/sign/compliance-documents/a/osha/1.pdf"),
                clock.instant());

        mockMvc.perform(post(BASE + "/verify", agency.getId())
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"complianceType\": \"osha_certified\", \"action\": \"verify\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.is_verified").value(true))
                .andExpect(jsonPath("$.data.state").value("VERIFIED"))
                .andExpect(jsonPath("$.message").value("Compliance document verified successfully"));

        mockMvc.perform(post(BASE + "/verify", agency.getId())
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"complianceType\": \"osha_certified\", \"action\": \"reject\", "
                                + "\"reason\": \"Card photo is unreadable\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.is_verified").value(false))
                .andExpect(jsonPath("$.data.document_url").value(nullValue()))
                .andExpect(jsonPath("$.message").value("Compliance document rejected successfully."));
    }

    @Test
    void review_unknownAction_isValidationError() throws Exception {
        mockMvc.perform(post(BASE + "/verify", agency.getId())
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"complianceType\": \"osha_certified\", \"action\": \"approve\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Action must be either \"verify\" or \"reject\""));
    }

    @Test
    void review_missingRow_isNotFound() throws Exception {
        mockMvc.perform(post(BASE + "/verify", agency.getId())
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"complianceType\": \"drug_testing\", \"action\": \"verify\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.message").value("Compliance record not found for type: drug_testing"));
    }

    @Test
    void updateSettings_thenList() throws Exception {
        mockMvc.perform(put(BASE, agency.getId())
                        .header(HttpHeaders.AUTHORIZATION, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items": [{"type": "general_liability", "isActive": true,
                                            "expirationDate": "2026-02-28", "notes": "Policy GL-77"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].compliance_type").value("general_liability"))
                .andExpect(jsonPath("$.data[0].display_name").value("General Liability Insurance"))
                .andExpect(jsonPath("$.data[0].is_active").value(true))
                .andExpect(jsonPath("$.data[0].state").value("NO_DOCUMENT"));

        mockMvc.perform(get(BASE, agency.getId()).header(HttpHeaders.AUTHORIZATION, TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1));
    }

    @Test
    void nonAdmin_isForbidden() throws Exception {
        mockMvc.perform(get(BASE, agency.getId()).header(HttpHeaders.AUTHORIZATION, "Bearer owner-token"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("FORBIDDEN"));
    }
}
