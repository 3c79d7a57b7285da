package com.findstaffing.api.error;

/**
 * An object storage operation failed.
 */
public class StorageException extends AdminOperationException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_ERROR, message, cause);
    }
}
