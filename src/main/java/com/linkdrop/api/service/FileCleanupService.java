package com.linkdrop.api.service;

import com.linkdrop.api.model.ShareRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reclaims shares that expired by time, plus exhausted records left behind. Enforcing the download cap is the
 * {@link DownloadGate}'s job; this sweeper only collects what is already dead.
 */
@Slf4j
@Service
public class FileCleanupService {

    private final ShareRegistry shareRegistry;
    private final StorageService storageService;
    private final Clock clock;

    public FileCleanupService(ShareRegistry shareRegistry, StorageService storageService, Clock clock) {
        this.shareRegistry = shareRegistry;
        this.storageService = storageService;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void sweepOnStartup() {
        sweep(LocalDateTime.now(clock));
    }

    @Scheduled(fixedRateString = "${app.cleanup.interval-ms:3600000}",
            initialDelayString = "${app.cleanup.interval-ms:3600000}")
    public void sweepPeriodically() {
        sweep(LocalDateTime.now(clock));
    }

    /**
     * Removes every expired or exhausted share and its file.
     *
     * @return number of share records removed
     */
    public int sweep(LocalDateTime now) {
        List<ShareRecord> removed = shareRegistry.sweepExpiredOrExhausted(now);
        int filesDeleted = 0;
        for (ShareRecord share : removed) {
            if (deleteFile(share)) {
                filesDeleted++;
            }
        }
        if (!removed.isEmpty()) {
            log.info("Sweep removed {} shares ({} files deleted)", removed.size(), filesDeleted);
        }
        return removed.size();
    }

    private boolean deleteFile(ShareRecord share) {
        try {
            // Missing is fine: the gate may already have removed it after a last download
            return storageService.deleteIfExists(share.getToken(), share.getFilename());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to delete file of share {}: {}", share.getId(), e.getClass().getSimpleName());
            return false;
        }
    }
}
