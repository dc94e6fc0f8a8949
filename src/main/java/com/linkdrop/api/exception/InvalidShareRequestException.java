package com.linkdrop.api.exception;

public class InvalidShareRequestException extends ShareException {

    public InvalidShareRequestException(String message) {
        super(ErrorCategory.INVALID_REQUEST, message);
    }
}
