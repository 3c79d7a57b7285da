package com.findstaffing.api.agency;

import com.findstaffing.api.error.ValidationException;
import com.findstaffing.api.reconcile.RelationKind;
import com.findstaffing.core.domain.Agency;
import com.findstaffing.core.domain.Agency.CompanySize;
import com.findstaffing.core.domain.Agency.EmployeeCount;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Typed form of a sparse agency edit request.
 *
 * Only keys present in the request are carried. An empty string clears a
 * nullable field. Relation id lists are kept apart from the scalar changes
 * because they go through the reconciler.
 */
public final class AgencyEditCommand {

    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final int MIN_FOUNDED_YEAR = 1800;

    private final Map<String, Object> scalarChanges;
    private final Map<RelationKind, List<UUID>> relationIds;

    private AgencyEditCommand(Map<String, Object> scalarChanges, Map<RelationKind, List<UUID>> relationIds) {
        this.scalarChanges = Collections.unmodifiableMap(scalarChanges);
        this.relationIds = Collections.unmodifiableMap(relationIds);
    }

    /**
     * Parses a request body.
     *
     * @throws ValidationException with one detail entry per offending key
     */
    public static AgencyEditCommand parse(Map<String, Object> body, int currentYear) {
        if (body == null) {
            throw new ValidationException("Invalid JSON body");
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        Map<RelationKind, List<UUID>> relationIds = new EnumMap<>(RelationKind.class);

        for (Map.Entry<String, Object> entry : body.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            try {
                Optional<RelationKind> relation = RelationKind.forRequestKey(key);
                if (relation.isPresent()) {
                    relationIds.put(relation.get(), parseIds(value));
                    continue;
                }
                switch (key) {
                    case "name" -> changes.put(key, parseName(value));
                    case "description" -> changes.put(key, optionalText(value, 5000, "Description"));
                    case "website", "phone", "email" -> changes.put(key, optionalText(value, 0, key));
                    case "headquarters" -> changes.put(key, optionalText(value, 200, "Headquarters"));
                    case "founded_year" -> changes.put(key, parseFoundedYear(value, currentYear));
                    case "employee_count" -> changes.put(key, parseEmployeeCount(value));
                    case "company_size" -> changes.put(key, parseCompanySize(value));
                    case "offers_per_diem", "is_union" -> changes.put(key, parseBoolean(value));
                    default -> errors.put(key, "Unknown field");
                }
            } catch (IllegalArgumentException e) {
                errors.put(key, e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid request body", errors);
        }
        return new AgencyEditCommand(changes, relationIds);
    }

    public boolean isEmpty() {
        return scalarChanges.isEmpty() && relationIds.isEmpty();
    }

    public boolean hasScalarChanges() {
        return !scalarChanges.isEmpty();
    }

    public Map<String, Object> scalarChanges() {
        return scalarChanges;
    }

    /**
     * Desired ids for a relation, empty when the relation was not part of the request.
     */
    public Optional<List<UUID>> desiredIds(RelationKind kind) {
        return Optional.ofNullable(relationIds.get(kind));
    }

    /**
     * Copies the scalar changes onto the agency. Audit fields are not touched.
     */
    public void applyTo(Agency agency) {
        scalarChanges.forEach((key, value) -> {
            switch (key) {
                case "name" -> agency.setName((String) value);
                case "description" -> agency.setDescription((String) value);
                case "website" -> agency.setWebsite((String) value);
                case "phone" -> agency.setPhone((String) value);
                case "email" -> agency.setEmail((String) value);
                case "headquarters" -> agency.setHeadquarters((String) value);
                case "founded_year" -> agency.setFoundedYear((Integer) value);
                case "employee_count" -> agency.setEmployeeCount((EmployeeCount) value);
                case "company_size" -> agency.setCompanySize((CompanySize) value);
                case "offers_per_diem" -> agency.setOffersPerDiem((Boolean) value);
                case "is_union" -> agency.setUnion((Boolean) value);
                default -> throw new IllegalStateException("Unhandled field " + key);
            }
        });
    }

    private static String parseName(Object value) {
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException("Company name must be a string");
        }
        String trimmed = text.trim();
        if (trimmed.length() < 2) {
            throw new IllegalArgumentException("Company name must be at least 2 characters");
        }
        if (trimmed.length() > 200) {
            throw new IllegalArgumentException("Company name must be less than 200 characters");
        }
        return trimmed;
    }

    /**
     * Trimmed text, or null for null/empty. A max length of 0 means unbounded.
     */
    private static String optionalText(Object value, int maxLength, String label) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(label + " must be a string");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (maxLength > 0 && trimmed.length() > maxLength) {
            throw new IllegalArgumentException(label + " must be less than " + maxLength + " characters");
        }
        return trimmed;
    }

    private static Integer parseFoundedYear(Object value, int currentYear) {
        String text = optionalText(value, 0, "Founded year");
        if (text == null) {
            return null;
        }
        if (!YEAR.matcher(text).matches()) {
            throw new IllegalArgumentException("Must be a valid year");
        }
        int year = Integer.parseInt(text);
        if (year < MIN_FOUNDED_YEAR || year > currentYear) {
            throw new IllegalArgumentException("Year must be between " + MIN_FOUNDED_YEAR + " and " + currentYear);
        }
        return year;
    }

    private static EmployeeCount parseEmployeeCount(Object value) {
        String label = optionalText(value, 0, "Employee count");
        return label == null ? null : EmployeeCount.fromLabel(label);
    }

    private static CompanySize parseCompanySize(Object value) {
        String label = optionalText(value, 0, "Company size");
        return label == null ? null : CompanySize.fromLabel(label);
    }

    private static Boolean parseBoolean(Object value) {
        if (!(value instanceof Boolean flag)) {
            throw new IllegalArgumentException("Must be a boolean");
        }
        return flag;
    }

    private static List<UUID> parseIds(Object value) {
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException("Must be an array of UUIDs");
        }
        List<UUID> ids = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String text)) {
                throw new IllegalArgumentException("Must be an array of UUIDs");
            }
            try {
                ids.add(UUID.fromString(text));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid UUID: " + text);
            }
        }
        return List.copyOf(ids);
    }
}
