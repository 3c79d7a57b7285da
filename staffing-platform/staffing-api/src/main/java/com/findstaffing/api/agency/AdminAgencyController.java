package com.findstaffing.api.agency;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.findstaffing.api.auth.AuthorizationGate;
import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.reconcile.ReferenceEntity;
import com.findstaffing.core.domain.AgencyProfileEdit;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin editing of agency profiles.
 */
@RestController
@RequestMapping("/api/v1/admin/agencies")
public class AdminAgencyController {

    private final AuthorizationGate authorizationGate;
    private final AgencyEditService agencyEditService;

    public AdminAgencyController(AuthorizationGate authorizationGate, AgencyEditService agencyEditService) {
        this.authorizationGate = authorizationGate;
        this.agencyEditService = agencyEditService;
    }

    /**
     * Partial update of scalar fields and, when {@code trade_ids}/{@code region_ids}
     * are present, reconciliation of those relations.
     */
    @PatchMapping("/{agencyId}")
    public ResponseEntity<AgencyEditResponse> edit(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) Map<String, Object> body) {

        CallerIdentity caller = authorizationGate.requireAdmin(authorization);
        AgencyEditService.AgencyEditResult result = agencyEditService.edit(agencyId, body, caller);

        return ResponseEntity.ok(new AgencyEditResponse(
                AgencyView.from(result.agency()),
                result.trades(),
                result.regions(),
                "Agency updated successfully"));
    }

    @GetMapping("/{agencyId}/edits")
    public ResponseEntity<EditHistoryResponse> history(
            @PathVariable UUID agencyId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        authorizationGate.requireAdmin(authorization);
        List<EditView> edits = agencyEditService.history(agencyId).stream()
                .map(EditView::from)
                .toList();
        return ResponseEntity.ok(new EditHistoryResponse(edits));
    }

    // DTOs

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AgencyEditResponse(
            AgencyView agency,
            List<ReferenceEntity> trades,
            List<ReferenceEntity> regions,
            String message
    ) {}

    public record EditHistoryResponse(List<EditView> data) {}

    public record EditView(
            UUID id,
            @JsonProperty("field_name") String fieldName,
            @JsonProperty("old_value") List<String> oldValue,
            @JsonProperty("new_value") List<String> newValue,
            @JsonProperty("edited_by") UUID editedBy,
            @JsonProperty("created_at") Instant createdAt
    ) {
        static EditView from(AgencyProfileEdit edit) {
            return new EditView(edit.getId(), edit.getFieldName(), edit.getOldValue(),
                    edit.getNewValue(), edit.getEditedBy(), edit.getCreatedAt());
        }
    }
}
