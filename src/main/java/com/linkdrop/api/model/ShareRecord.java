package com.linkdrop.api.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "shares")
@Data
@Builder
@NoArgsConstructor // Required by JPA
@AllArgsConstructor
public class ShareRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Display name, already stripped of any directory part
    @Column(nullable = false)
    private String filename;

    // Public link identifier, also the prefix of the file on disk
    @Column(nullable = false, unique = true, updatable = false)
    private String token;

    private long size;
    private String contentType;

    // --- Self-Destruct Rules (all times are UTC) ---
    @Column(nullable = false)
    private LocalDateTime expiresAt;

    // null means unlimited
    private Integer maxDownloads;

    private int downloadCount;

    private LocalDateTime createdAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isExhausted() {
        return maxDownloads != null && downloadCount >= maxDownloads;
    }
}
