package com.findstaffing.api.error;

import org.springframework.http.HttpStatus;

/**
 * Stable, machine-readable failure kinds. The code is what clients see.
 */
public enum ErrorKind {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    DATABASE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return name();
    }
}
