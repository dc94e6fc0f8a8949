package com.linkdrop.api.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Everything about an upload except its bytes.
 */
@Value
@Builder
public class UploadCommand {

    // Client-chosen id for progress polling; generated when absent
    String uploadId;

    String filename;

    String contentType;

    // Length announced by the client, null when unknown
    Long declaredLength;

    Duration ttl;

    Integer maxDownloads;
}
