package com.findstaffing.api.compliance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.findstaffing.api.auth.AuthorizationGate;
import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.core.domain.AgencyCompliance;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Admin management of agency compliance: settings, document upload/removal
 * and verification review.
 */
@RestController
@RequestMapping("/api/v1/admin/agencies/{agencyId}/compliance")
public class AdminComplianceController {

    private final AuthorizationGate authorizationGate;
    private final ComplianceDocumentService documentService;
    private final ComplianceSettingsService settingsService;

    public AdminComplianceController(AuthorizationGate authorizationGate,
                                     ComplianceDocumentService documentService,
                                     ComplianceSettingsService settingsService) {
        this.authorizationGate = authorizationGate;
        this.documentService = documentService;
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseEntity<ComplianceListResponse> list(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        authorizationGate.requireAdmin(authorization);
        return ResponseEntity.ok(toListResponse(settingsService.list(agencyId)));
    }

    @PutMapping
    public ResponseEntity<ComplianceListResponse> updateSettings(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SettingsRequest request) {

        CallerIdentity caller = authorizationGate.requireAdmin(authorization);
        List<ComplianceSettingsService.SettingsItem> items = request == null ? null : request.items();
        return ResponseEntity.ok(toListResponse(settingsService.update(agencyId, items, caller)));
    }

    @PostMapping(value = "/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> uploadDocument(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "compliance_type", required = false) String complianceType) {

        CallerIdentity caller = authorizationGate.requireAdmin(authorization);
        String documentUrl = documentService.upload(agencyId, complianceType, toDocument(file), caller);
        return ResponseEntity.ok(new DocumentResponse(true, new DocumentData(documentUrl)));
    }

    @DeleteMapping("/document")
    public ResponseEntity<DocumentResponse> deleteDocument(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(value = "compliance_type", required = false) String complianceType) {

        CallerIdentity caller = authorizationGate.requireAdmin(authorization);
        documentService.removeDocument(agencyId, complianceType, caller);
        return ResponseEntity.ok(new DocumentResponse(true, new DocumentData(null)));
    }

    /**
     * Verifies or rejects the current document of one compliance type.
     */
    @PostMapping("/verify")
    public ResponseEntity<ReviewResponse> review(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) ReviewRequest request) {

        CallerIdentity caller = authorizationGate.requireAdmin(authorization);
        if (request == null) {
            throw new ValidationException("Invalid JSON in request body");
        }
        ComplianceDocumentService.parseType(request.complianceType(), null);

        ComplianceDocumentService.ReviewOutcome outcome;
        if ("verify".equals(request.action())) {
            outcome = documentService.verify(agencyId, request.complianceType(), request.notes(), caller);
        } else if ("reject".equals(request.action())) {
            outcome = documentService.reject(agencyId, request.complianceType(), request.reason(), request.notes(), caller);
        } else {
            throw new ValidationException("Action must be either \"verify\" or \"reject\"");
        }
        return ResponseEntity.ok(new ReviewResponse(ComplianceView.from(outcome.compliance()), outcome.message()));
    }

    private static UploadedDocument toDocument(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return null;
        }
        try {
            return new UploadedDocument(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new ValidationException("Invalid form data");
        }
    }

    private static ComplianceListResponse toListResponse(List<AgencyCompliance> rows) {
        return new ComplianceListResponse(rows.stream().map(ComplianceView::from).toList());
    }

    // DTOs

    public record SettingsRequest(List<ComplianceSettingsService.SettingsItem> items) {}

    public record ReviewRequest(String complianceType, String action, String reason, String notes) {}

    public record ComplianceListResponse(List<ComplianceView> data) {}

    public record DocumentResponse(boolean success, DocumentData data) {}

    public record DocumentData(@JsonProperty("document_url") String documentUrl) {}

    public record ReviewResponse(ComplianceView data, String message) {}
}
