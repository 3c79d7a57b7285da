package com.findstaffing.api.error;

/**
 * Caller could not be identified.
 */
public class UnauthorizedException extends AdminOperationException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
