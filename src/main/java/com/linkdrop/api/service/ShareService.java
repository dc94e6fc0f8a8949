package com.linkdrop.api.service;

import com.linkdrop.api.exception.StorageException;
import com.linkdrop.api.model.ShareRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

// Owner-facing listing and manual deletion of shares
@Slf4j
@Service
public class ShareService {

    private final ShareRegistry shareRegistry;
    private final StorageService storageService;
    private final Clock clock;

    public ShareService(ShareRegistry shareRegistry, StorageService storageService, Clock clock) {
        this.shareRegistry = shareRegistry;
        this.storageService = storageService;
        this.clock = clock;
    }

    public List<ShareRecord> listActive() {
        return shareRegistry.listActive(LocalDateTime.now(clock));
    }

    public void delete(Long id) {
        ShareRecord share = shareRegistry.deleteById(id);
        try {
            storageService.deleteIfExists(share.getToken(), share.getFilename());
        } catch (IOException e) {
            throw new StorageException("Could not delete file of share " + id, e);
        }
        log.info("Deleted share {} on request", id);
    }
}
