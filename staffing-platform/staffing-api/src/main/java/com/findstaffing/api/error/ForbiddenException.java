package com.findstaffing.api.error;

/**
 * Caller is identified but lacks the admin role.
 */
public class ForbiddenException extends AdminOperationException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
