package com.linkdrop.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Client-facing failure categories and the HTTP status each one maps to.
 */
public enum ErrorCategory {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    EXPIRED(HttpStatus.GONE),
    LIMIT_REACHED(HttpStatus.GONE),
    TOO_LARGE(HttpStatus.PAYLOAD_TOO_LARGE),
    INTERNAL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
