package com.findstaffing.api.error;

/**
 * Agency or compliance record does not exist.
 */
public class NotFoundException extends AdminOperationException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
