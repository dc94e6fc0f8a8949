package com.linkdrop.api.exception;

public class DownloadLimitReachedException extends ShareException {

    public DownloadLimitReachedException(String message) {
        super(ErrorCategory.LIMIT_REACHED, message);
    }
}
