package com.linkdrop.api.service;

import com.linkdrop.api.exception.ShareNotFoundException;
import com.linkdrop.api.exception.StorageException;
import com.linkdrop.api.model.DownloadOutcome;
import com.linkdrop.api.model.ShareRecord;
import com.linkdrop.api.repository.ShareRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

// Share metadata; concurrent requests only meet inside database transactions
@Slf4j
@Service
public class ShareRegistry {

    static final int MAX_TOKEN_ATTEMPTS = 5;

    private final ShareRepository shareRepository;
    private final TokenGenerator tokenGenerator;
    private final ExhaustedShareTracker exhaustedShares;
    private final Clock clock;

    public ShareRegistry(ShareRepository shareRepository,
                         TokenGenerator tokenGenerator,
                         ExhaustedShareTracker exhaustedShares,
                         Clock clock) {
        this.shareRepository = shareRepository;
        this.tokenGenerator = tokenGenerator;
        this.exhaustedShares = exhaustedShares;
        this.clock = clock;
    }

    // A taken token, seen by the pre-check or the unique constraint, is replaced and the insert retried
    public ShareRecord create(String filename, Duration ttl, Integer maxDownloads, long size, String contentType) {
        for (int attempt = 1; attempt <= MAX_TOKEN_ATTEMPTS; attempt++) {
            String token = tokenGenerator.generate();
            if (shareRepository.existsByToken(token)) {
                log.warn("Token collision on attempt {}, retrying", attempt);
                continue;
            }
            LocalDateTime now = now();
            ShareRecord record = ShareRecord.builder()
                    .filename(FilenameSanitizer.sanitize(filename))
                    .token(token)
                    .size(size)
                    .contentType(contentType)
                    .expiresAt(now.plus(ttl))
                    .maxDownloads(maxDownloads)
                    .downloadCount(0)
                    .createdAt(now)
                    .build();
            try {
                ShareRecord saved = shareRepository.saveAndFlush(record);
                log.info("Created share {} for '{}' expiring at {}", saved.getId(), saved.getFilename(),
                        saved.getExpiresAt());
                return saved;
            } catch (DataIntegrityViolationException e) {
                log.warn("Token collision on insert, attempt {}, retrying", attempt);
            }
        }
        throw new StorageException("Could not allocate a unique share token");
    }

    public ShareRecord get(String token) {
        return shareRepository.findByToken(token)
                .orElseThrow(() -> new ShareNotFoundException("Not found"));
    }

    /**
     * Whether {@code token} named a share that was removed by its last download and would still be live otherwise.
     */
    public boolean wasExhausted(String token, LocalDateTime now) {
        return exhaustedShares.isExhausted(token, now);
    }

    public List<ShareRecord> listActive(LocalDateTime now) {
        return shareRepository.findByExpiresAtAfterOrderByCreatedAtDesc(now);
    }

    // Only one of two requests racing for the final slot can match the conditional update
    @Transactional
    public DownloadOutcome incrementAndMaybeDelete(String token, LocalDateTime now) {
        int updated = shareRepository.incrementIfLive(token, now);
        Optional<ShareRecord> current = shareRepository.findByToken(token);
        if (updated == 0) {
            return current.map(record -> record.isExpiredAt(now) ? DownloadOutcome.EXPIRED
                            : DownloadOutcome.LIMIT_REACHED)
                    .orElse(DownloadOutcome.NOT_FOUND);
        }

        ShareRecord record = current.orElseThrow(() -> new StorageException("Share vanished inside its transaction"));
        if (record.isExhausted()) {
            // Marked before the delete commits so no request can find neither the row nor the mark
            exhaustedShares.markExhausted(token, record.getExpiresAt());
            shareRepository.deleteByTokenValue(token);
            log.info("Share {} reached its download limit of {}, record removed", record.getId(),
                    record.getMaxDownloads());
            return DownloadOutcome.LAST_DOWNLOAD;
        }
        return DownloadOutcome.CONTINUING;
    }

    @Transactional
    public ShareRecord deleteById(Long id) {
        ShareRecord record = shareRepository.findById(id)
                .orElseThrow(() -> new ShareNotFoundException("Not found"));
        shareRepository.delete(record);
        return record;
    }

    // Returns the removed rows so their files can go too
    @Transactional
    public List<ShareRecord> sweepExpiredOrExhausted(LocalDateTime now) {
        List<ShareRecord> doomed = shareRepository.findExpiredOrExhausted(now);
        if (!doomed.isEmpty()) {
            shareRepository.deleteByIdIn(doomed.stream().map(ShareRecord::getId).toList());
        }
        return doomed;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
