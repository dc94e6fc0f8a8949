package com.linkdrop.api.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers tokens whose share was removed by its last download, until the share would have expired anyway, so a
 * late request for a used-up link is told the limit was reached rather than that the link never existed.
 * Lost on restart; such requests then see not-found.
 */
@Component
public class ExhaustedShareTracker {

    private final Map<String, LocalDateTime> exhausted = new ConcurrentHashMap<>();
    private final Clock clock;

    public ExhaustedShareTracker(Clock clock) {
        this.clock = clock;
    }

    public void markExhausted(String token, LocalDateTime expiresAt) {
        exhausted.put(token, expiresAt);
    }

    public boolean isExhausted(String token, LocalDateTime now) {
        LocalDateTime expiresAt = exhausted.get(token);
        return expiresAt != null && now.isBefore(expiresAt);
    }

    @Scheduled(fixedDelayString = "${app.purge.interval-ms:60000}")
    public void purgeExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        exhausted.values().removeIf(expiresAt -> !now.isBefore(expiresAt));
    }

    int size() {
        return exhausted.size();
    }
}
