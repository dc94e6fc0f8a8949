package com.linkdrop.api.repository;

import com.linkdrop.api.model.ShareRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ShareRepository extends JpaRepository<ShareRecord, Long> {

    Optional<ShareRecord> findByToken(String token);

    boolean existsByToken(String token);

    List<ShareRecord> findByExpiresAtAfterOrderByCreatedAtDesc(LocalDateTime now);

    @Query("""
        SELECT s FROM ShareRecord s
        WHERE s.expiresAt <= :now
           OR (s.maxDownloads IS NOT NULL AND s.downloadCount >= s.maxDownloads)
    """)
    List<ShareRecord> findExpiredOrExhausted(@Param("now") LocalDateTime now);

    /**
     * Counts one download if, and only if, the share is still live. Returns the number of rows touched, so 0 means
     * the share is missing, expired or already at its cap.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ShareRecord s SET s.downloadCount = s.downloadCount + 1
        WHERE s.token = :token
          AND s.expiresAt > :now
          AND (s.maxDownloads IS NULL OR s.downloadCount < s.maxDownloads)
    """)
    int incrementIfLive(@Param("token") String token, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM ShareRecord s WHERE s.token = :token")
    int deleteByTokenValue(@Param("token") String token);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM ShareRecord s WHERE s.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}
