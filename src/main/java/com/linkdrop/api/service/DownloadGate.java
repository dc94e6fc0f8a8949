package com.linkdrop.api.service;

import com.linkdrop.api.exception.DownloadLimitReachedException;
import com.linkdrop.api.exception.ShareExpiredException;
import com.linkdrop.api.exception.ShareException;
import com.linkdrop.api.exception.ShareNotFoundException;
import com.linkdrop.api.exception.StorageException;
import com.linkdrop.api.model.DownloadOutcome;
import com.linkdrop.api.model.ShareRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Decides whether a share may be downloaded right now and accounts the download.
 *
 * <p>Expired and exhausted shares are refused without touching the record. A granted download has already been
 * counted (and, for the last one, the record removed) by the time the caller receives its {@link DownloadTicket}.
 */
@Slf4j
@Service
public class DownloadGate {

    private final ShareRegistry shareRegistry;
    private final StorageService storageService;
    private final TransferLeases transferLeases;
    private final Clock clock;

    public DownloadGate(ShareRegistry shareRegistry,
                        StorageService storageService,
                        TransferLeases transferLeases,
                        Clock clock) {
        this.shareRegistry = shareRegistry;
        this.storageService = storageService;
        this.transferLeases = transferLeases;
        this.clock = clock;
    }

    public DownloadTicket open(String token) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. Check metadata (no mutation on any refusal)
        ShareRecord share;
        try {
            share = shareRegistry.get(token);
        } catch (ShareNotFoundException e) {
            throw refusalForMissing(token, now, e);
        }
        if (share.isExpiredAt(now)) {
            throw new ShareExpiredException("Expired");
        }
        if (share.isExhausted()) {
            throw new DownloadLimitReachedException("Limit reached");
        }

        // 2. Count the download atomically; the outcome may differ from what the read above suggested
        transferLeases.acquire(token);
        try {
            DownloadOutcome outcome = shareRegistry.incrementAndMaybeDelete(token, now);
            switch (outcome) {
                case NOT_FOUND:
                    throw refusalForMissing(token, now, new ShareNotFoundException("Not found"));
                case EXPIRED:
                    throw new ShareExpiredException("Expired");
                case LIMIT_REACHED:
                    throw new DownloadLimitReachedException("Limit reached");
                case LAST_DOWNLOAD:
                    transferLeases.markForDiscard(token);
                    break;
                default:
                    break;
            }
            return issueTicket(share, outcome);
        } catch (RuntimeException e) {
            releaseWithoutTransfer(share);
            throw e;
        }
    }

    private DownloadTicket issueTicket(ShareRecord share, DownloadOutcome outcome) {
        // 3. Open the file now: once open, a sweep or owner delete unlinking it cannot cut the transfer short
        String token = share.getToken();
        try {
            long length = storageService.size(token, share.getFilename());
            InputStream in = storageService.open(token, share.getFilename());
            return new DownloadTicket(share, outcome, length, in, storageService, transferLeases);
        } catch (NoSuchFileException e) {
            // Metadata and storage only disagree after outside interference
            log.warn("Share {} is live but its file is missing", share.getId());
            throw new ShareNotFoundException("File missing");
        } catch (IOException e) {
            throw new StorageException("Could not read file of share " + share.getId(), e);
        }
    }

    // A refused or failed download still hands its lease back, and may be the one that frees the file
    private void releaseWithoutTransfer(ShareRecord share) {
        if (transferLeases.release(share.getToken())) {
            DownloadTicket.discardFile(share, storageService);
        }
    }

    // A missing row may be one another request just used up
    private ShareException refusalForMissing(String token, LocalDateTime now, ShareNotFoundException notFound) {
        if (shareRegistry.wasExhausted(token, now)) {
            return new DownloadLimitReachedException("Limit reached");
        }
        return notFound;
    }
}
