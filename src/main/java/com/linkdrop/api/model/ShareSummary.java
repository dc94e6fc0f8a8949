package com.linkdrop.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

// One row of the owner's share listing
@Value
@Builder
public class ShareSummary {
    Long id;
    String filename;
    String shareId;
    LocalDateTime expiresAt;
    Integer maxDownloads;
    int downloadCount;

    public static ShareSummary from(ShareRecord record) {
        return ShareSummary.builder()
                .id(record.getId())
                .filename(record.getFilename())
                .shareId(record.getToken())
                .expiresAt(record.getExpiresAt())
                .maxDownloads(record.getMaxDownloads())
                .downloadCount(record.getDownloadCount())
                .build();
    }
}
