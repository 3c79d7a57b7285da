package com.findstaffing.api.error;

/**
 * A relational read or write on the primary path failed.
 */
public class StoreException extends AdminOperationException {

    public StoreException(String message, Throwable cause) {
        super(ErrorKind.DATABASE_ERROR, message, cause);
    }
}
