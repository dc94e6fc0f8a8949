package com.linkdrop.api.exception;

/**
 * Unexpected I/O or database failure. The message stays server side.
 */
public class StorageException extends ShareException {

    public StorageException(String message) {
        super(ErrorCategory.INTERNAL_FAILURE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorCategory.INTERNAL_FAILURE, message, cause);
    }
}
