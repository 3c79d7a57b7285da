package com.findstaffing.api.error;

import java.util.Map;

/**
 * Malformed input, unknown references or a disallowed lifecycle action.
 * Always raised before anything is mutated.
 */
public class ValidationException extends AdminOperationException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, ?> details) {
        super(ErrorKind.VALIDATION_ERROR, message, details, null);
    }
}
