package com.findstaffing.api.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every failure an admin operation reports to its caller.
 * Carries the error kind and, for validation failures, the offending values.
 */
public class AdminOperationException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    public AdminOperationException(ErrorKind kind, String message) {
        this(kind, message, Map.of(), null);
    }

    public AdminOperationException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, Map.of(), cause);
    }

    public AdminOperationException(ErrorKind kind, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Structured detail payload, empty when there is none.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
