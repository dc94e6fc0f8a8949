package com.linkdrop.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Snapshot of one upload session. Entries are replaced, never mutated in place.
 */
@Value
@Builder
@With
public class UploadProgress {

    String uploadId;

    // 0 when the client did not announce a length
    long total;

    long uploaded;

    UploadStatus status;

    // Set once the status is terminal
    @JsonIgnore
    Instant evictAt;

    public static UploadProgress starting(String uploadId, long total) {
        return UploadProgress.builder()
                .uploadId(uploadId)
                .total(Math.max(total, 0))
                .uploaded(0)
                .status(UploadStatus.STARTING)
                .build();
    }

    public boolean isEvictableAt(Instant now) {
        return evictAt != null && !now.isBefore(evictAt);
    }
}
