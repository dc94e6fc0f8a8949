package com.linkdrop.api.service;

import com.linkdrop.api.model.DownloadOutcome;
import com.linkdrop.api.model.ShareRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A download the gate has already accounted for, holding the file open. When the share is used up, the file is
 * deleted once the last transfer still running for it has ended, successfully or not.
 */
@Slf4j
public class DownloadTicket {

    private final ShareRecord share;
    private final DownloadOutcome outcome;
    private final long contentLength;
    private final InputStream content;
    private final StorageService storageService;
    private final TransferLeases transferLeases;

    DownloadTicket(ShareRecord share,
                   DownloadOutcome outcome,
                   long contentLength,
                   InputStream content,
                   StorageService storageService,
                   TransferLeases transferLeases) {
        this.share = share;
        this.outcome = outcome;
        this.contentLength = contentLength;
        this.content = content;
        this.storageService = storageService;
        this.transferLeases = transferLeases;
    }

    public String getFilename() {
        return share.getFilename();
    }

    public String getContentType() {
        return share.getContentType();
    }

    public long getContentLength() {
        return contentLength;
    }

    public DownloadOutcome getOutcome() {
        return outcome;
    }

    /**
     * Copies the file opened by the gate to {@code out} and flushes it, then runs the completion hook.
     */
    public void transferTo(OutputStream out) throws IOException {
        try (InputStream in = content) {
            in.transferTo(out);
            out.flush();
        } finally {
            onTransferComplete();
        }
    }

    void onTransferComplete() {
        if (transferLeases.release(share.getToken())) {
            discardFile(share, storageService);
        }
    }

    // The record is already gone, so nothing else would ever reclaim this file
    static void discardFile(ShareRecord share, StorageService storageService) {
        try {
            storageService.deleteIfExists(share.getToken(), share.getFilename());
            log.info("Deleted file of share {} after its last download", share.getId());
        } catch (IOException e) {
            log.warn("Could not delete file of exhausted share {}: {}", share.getId(), e.getClass().getSimpleName());
        }
    }
}
