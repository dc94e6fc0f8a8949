package com.linkdrop.api.exception;

/**
 * Base for every failure the share API reports to callers.
 */
public abstract class ShareException extends RuntimeException {

    private final ErrorCategory category;

    protected ShareException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected ShareException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
