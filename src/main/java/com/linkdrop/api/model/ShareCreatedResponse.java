package com.linkdrop.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class ShareCreatedResponse {
    String token;
    LocalDateTime expiresAt;
    Integer maxDownloads;
    String uploadId;

    public static ShareCreatedResponse from(ShareRecord record, String uploadId) {
        return ShareCreatedResponse.builder()
                .token(record.getToken())
                .expiresAt(record.getExpiresAt())
                .maxDownloads(record.getMaxDownloads())
                .uploadId(uploadId)
                .build();
    }
}
