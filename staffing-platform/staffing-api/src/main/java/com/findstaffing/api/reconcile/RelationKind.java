package com.findstaffing.api.reconcile;

import java.util.Optional;

/**
 * Join relations an administrator can reconcile on an agency.
 */
public enum RelationKind {
    TRADES("trades", "trade_ids", "invalid_trade_ids", "trade"),
    REGIONS("regions", "region_ids", "invalid_region_ids", "region");

    private final String fieldName;
    private final String requestKey;
    private final String invalidIdsKey;
    private final String noun;

    RelationKind(String fieldName, String requestKey, String invalidIdsKey, String noun) {
        this.fieldName = fieldName;
        this.requestKey = requestKey;
        this.invalidIdsKey = invalidIdsKey;
        this.noun = noun;
    }

    /** Field name written to the profile edit log. */
    public String fieldName() { return fieldName; }

    /** Key of the id array in an edit request. */
    public String requestKey() { return requestKey; }

    /** Detail key enumerating unknown ids in a validation error. */
    public String invalidIdsKey() { return invalidIdsKey; }

    public String noun() { return noun; }

    /**
     * Relation whose id array an edit request carries under {@code key}.
     */
    public static Optional<RelationKind> forRequestKey(String key) {
        for (RelationKind kind : values()) {
            if (kind.requestKey.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /** Capitalized relation name for messages, e.g. "Trades". */
    public String label() {
        return Character.toUpperCase(fieldName.charAt(0)) + fieldName.substring(1);
    }
}
