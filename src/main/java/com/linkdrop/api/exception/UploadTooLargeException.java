package com.linkdrop.api.exception;

public class UploadTooLargeException extends ShareException {

    public UploadTooLargeException(long maxSize) {
        super(ErrorCategory.TOO_LARGE, "File exceeds the maximum upload size of " + maxSize + " bytes");
    }
}
