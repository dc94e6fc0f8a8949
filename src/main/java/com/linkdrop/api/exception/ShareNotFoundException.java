package com.linkdrop.api.exception;

/**
 * Unknown token or id, or a live record whose backing file is gone.
 */
public class ShareNotFoundException extends ShareException {

    public ShareNotFoundException(String message) {
        super(ErrorCategory.NOT_FOUND, message);
    }
}
