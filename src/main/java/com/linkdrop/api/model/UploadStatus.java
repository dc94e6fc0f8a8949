package com.linkdrop.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum UploadStatus {
    STARTING,
    UPLOADING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
