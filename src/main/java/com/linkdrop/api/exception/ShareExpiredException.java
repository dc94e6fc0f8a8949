package com.linkdrop.api.exception;

public class ShareExpiredException extends ShareException {

    public ShareExpiredException(String message) {
        super(ErrorCategory.EXPIRED, message);
    }
}
