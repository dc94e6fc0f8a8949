package com.linkdrop.api.exception;

// Caller has no session
public class UnauthenticatedException extends ShareException {

    public UnauthenticatedException(String message) {
        super(ErrorCategory.UNAUTHENTICATED, message);
    }
}
