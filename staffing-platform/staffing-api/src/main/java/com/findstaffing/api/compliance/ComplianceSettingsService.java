package com.findstaffing.api.compliance;

import com.findstaffing.api.agency.AgencyStore;
import com.findstaffing.api.auth.CallerIdentity;
import com.findstaffing.api.error.NotFoundException;
import com.findstaffing.api.error.StoreException;
import com.findstaffing.api.error.ValidationException;
import com.findstaffing.core.domain.AgencyCompliance;
import com.findstaffing.core.domain.ComplianceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-type compliance settings (active flag, expiration date, notes).
 * Settings never touch the document or its verification.
 */
@Service
public class ComplianceSettingsService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceSettingsService.class);

    private final AgencyStore agencyStore;
    private final ComplianceStore complianceStore;
    private final Clock clock;

    public ComplianceSettingsService(AgencyStore agencyStore, ComplianceStore complianceStore, Clock clock) {
        this.agencyStore = agencyStore;
        this.complianceStore = complianceStore;
        this.clock = clock;
    }

    public List<AgencyCompliance> list(UUID agencyId) {
        requireAgency(agencyId);
        try {
            return complianceStore.findAll(agencyId);
        } catch (RuntimeException e) {
            throw new StoreException("Failed to fetch compliance data", e);
        }
    }

    /**
     * Validates every item, then upserts them one by one in request order.
     * Returns the agency's full compliance list afterwards.
     */
    public List<AgencyCompliance> update(UUID agencyId, List<SettingsItem> items, CallerIdentity caller) {
        if (items == null) {
            throw new ValidationException("Request body must include an items array");
        }
        List<ValidSettings> validated = validate(items);
        requireAgency(agencyId);

        Instant now = clock.instant();
        for (ValidSettings settings : validated) {
            try {
                AgencyCompliance row = complianceStore.find(agencyId, settings.type())
                        .orElseGet(() -> AgencyCompliance.create(agencyId, settings.type(), now));
                row.updateSettings(settings.active(), settings.expirationDate(), settings.notes(), now);
                complianceStore.save(row);
            } catch (RuntimeException e) {
                throw new StoreException("Failed to update compliance data", e);
            }
        }
        log.info("Compliance settings of agency {} updated by {}: {} item(s)", agencyId, caller.userId(), validated.size());
        return list(agencyId);
    }

    private List<ValidSettings> validate(List<SettingsItem> items) {
        Map<String, String> errors = new LinkedHashMap<>();
        List<ValidSettings> validated = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            SettingsItem item = items.get(i);
            String prefix = "items[" + i + "]";
            if (item == null) {
                errors.put(prefix, "Item is required");
                continue;
            }
            ComplianceType type = ComplianceType.fromWireValue(item.type()).orElse(null);
            if (type == null) {
                errors.put(prefix + ".type", "Invalid compliance type: " + item.type());
            }
            if (item.isActive() == null) {
                errors.put(prefix + ".isActive", "isActive must be a boolean");
            }
            LocalDate expiration = null;
            if (item.expirationDate() != null && !item.expirationDate().isBlank()) {
                try {
                    expiration = LocalDate.parse(item.expirationDate());
                } catch (DateTimeParseException e) {
                    errors.put(prefix + ".expirationDate", "Expiration date must be in YYYY-MM-DD format");
                }
            }
            if (type != null && item.isActive() != null) {
                validated.add(new ValidSettings(type, item.isActive(), expiration, blankToNull(item.notes())));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid compliance data", errors);
        }
        return validated;
    }

    private void requireAgency(UUID agencyId) {
        boolean exists;
        try {
            exists = agencyStore.find(agencyId).isPresent();
        } catch (RuntimeException e) {
            throw new StoreException("Failed to fetch agency", e);
        }
        if (!exists) {
            throw new NotFoundException("Agency not found");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * One item of a settings update as received.
     */
    public record SettingsItem(String type, Boolean isActive, String expirationDate, String notes) {}

    private record ValidSettings(ComplianceType type, boolean active, LocalDate expirationDate, String notes) {}
}
