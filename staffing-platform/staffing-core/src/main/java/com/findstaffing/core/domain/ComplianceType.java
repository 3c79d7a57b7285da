package com.findstaffing.core.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Compliance credentials an agency can hold. The wire value is the
 * lower-case key used in requests, storage paths and the database.
 */
public enum ComplianceType {
    OSHA_CERTIFIED("osha_certified", "OSHA Certified",
            "Workers hold current OSHA safety training certifications"),
    DRUG_TESTING("drug_testing", "Drug Testing Policy",
            "Agency runs pre-placement and random drug screening"),
    BACKGROUND_CHECKS("background_checks", "Background Checks",
            "Workers are screened with criminal background checks"),
    WORKERS_COMP("workers_comp", "Workers' Compensation",
            "Agency carries workers' compensation insurance"),
    GENERAL_LIABILITY("general_liability", "General Liability Insurance",
            "Agency carries general liability insurance coverage"),
    BONDING("bonding", "Bonded",
            "Agency is bonded to protect clients against losses");

    private final String wireValue;
    private final String displayName;
    private final String description;

    ComplianceType(String wireValue, String displayName, String description) {
        this.wireValue = wireValue;
        this.displayName = displayName;
        this.description = description;
    }

    public String wireValue() { return wireValue; }
    public String displayName() { return displayName; }
    public String description() { return description; }

    public static Optional<ComplianceType> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(value))
                .findFirst();
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(ComplianceType::wireValue).toList();
    }
}
