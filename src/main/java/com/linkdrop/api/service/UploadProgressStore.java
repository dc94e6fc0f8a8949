package com.linkdrop.api.service;

import com.linkdrop.api.model.UploadProgress;
import com.linkdrop.api.model.UploadStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory progress of uploads, keyed by upload id. Each upload only ever touches its own entry. Finished entries
 * stay readable for the retention window and are then dropped by {@link #purgeExpired()}; reads ignore entries
 * already past their window.
 */
@Slf4j
@Service
public class UploadProgressStore {

    private final Map<String, UploadProgress> entries = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Clock clock;

    public UploadProgressStore(@Value("${app.upload.progress-retention:5m}") Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Registers a new upload.
     *
     * @return false if the id is already in use
     */
    public boolean start(String uploadId, long total) {
        Instant now = clock.instant();
        boolean[] started = {false};
        entries.compute(uploadId, (id, current) -> {
            // An entry past its window is free to reuse even if the purge has not run yet
            if (current != null && !current.isEvictableAt(now)) {
                return current;
            }
            started[0] = true;
            return UploadProgress.starting(id, total);
        });
        return started[0];
    }

    /**
     * Records the running byte count. Smaller values than the last one seen are ignored.
     */
    public void advance(String uploadId, long uploaded) {
        entries.computeIfPresent(uploadId, (id, current) -> current.getStatus().isTerminal()
                ? current
                : current.withUploaded(Math.max(current.getUploaded(), uploaded)).withStatus(UploadStatus.UPLOADING));
    }

    public void complete(String uploadId, long uploaded) {
        entries.computeIfPresent(uploadId, (id, current) -> current
                .withUploaded(Math.max(current.getUploaded(), uploaded))
                .withStatus(UploadStatus.COMPLETED)
                .withEvictAt(evictionDeadline()));
    }

    public void fail(String uploadId) {
        entries.computeIfPresent(uploadId, (id, current) -> current
                .withStatus(UploadStatus.FAILED)
                .withEvictAt(evictionDeadline()));
    }

    public Optional<UploadProgress> find(String uploadId) {
        UploadProgress progress = entries.get(uploadId);
        if (progress == null || progress.isEvictableAt(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(progress);
    }

    @Scheduled(fixedDelayString = "${app.purge.interval-ms:60000}")
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, UploadProgress> entry : entries.entrySet()) {
            if (entry.getValue().isEvictableAt(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Evicted {} finished upload progress entries", removed);
        }
        return removed;
    }

    int size() {
        return entries.size();
    }

    private Instant evictionDeadline() {
        return clock.instant().plus(retention);
    }
}
