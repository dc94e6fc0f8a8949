package com.linkdrop.api.service;

import com.linkdrop.api.exception.DownloadLimitReachedException;
import com.linkdrop.api.exception.ShareExpiredException;
import com.linkdrop.api.exception.ShareNotFoundException;
import com.linkdrop.api.model.DownloadOutcome;
import com.linkdrop.api.model.ShareRecord;
import com.linkdrop.api.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DownloadGateTest {

    private static final String TOKEN = "abc123";
    private static final byte[] CONTENT = "hello, share".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path uploadDir;

    private MutableClock clock;
    private ShareRegistry shareRegistry;
    private FileSystemStorageService storageService;
    private TransferLeases transferLeases;
    private DownloadGate gate;

    @BeforeEach
    void setUp() throws IOException {
        clock = new MutableClock();
        shareRegistry = mock(ShareRegistry.class);
        storageService = new FileSystemStorageService(uploadDir.toString());
        transferLeases = new TransferLeases();
        gate = new DownloadGate(shareRegistry, storageService, transferLeases, clock);
        Files.write(uploadDir.resolve(TOKEN + "-notes.txt"), CONTENT);
    }

    @Test
    void unknownTokenIsNotFound() {
        when(shareRegistry.get("missing")).thenThrow(new ShareNotFoundException("Not found"));

        assertThatThrownBy(() -> gate.open("missing")).isInstanceOf(ShareNotFoundException.class);
        verify(shareRegistry, never()).incrementAndMaybeDelete(anyString(), any());
    }

    @Test
    void usedUpLinkIsLimitReachedRatherThanNotFound() {
        when(shareRegistry.get(TOKEN)).thenThrow(new ShareNotFoundException("Not found"));
        when(shareRegistry.wasExhausted(eq(TOKEN), any())).thenReturn(true);

        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(DownloadLimitReachedException.class);
    }

    @Test
    void expiredShareIsRefusedWithoutCounting() {
        // Expiry wins even though downloads remain
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ZERO, 5, 0));

        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(ShareExpiredException.class);
        verify(shareRegistry, never()).incrementAndMaybeDelete(anyString(), any());
        assertThat(uploadDir.resolve(TOKEN + "-notes.txt")).exists();
    }

    @Test
    void exhaustedShareIsRefusedWithoutCounting() {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), 2, 2));

        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(DownloadLimitReachedException.class);
        verify(shareRegistry, never()).incrementAndMaybeDelete(anyString(), any());
    }

    @Test
    void refusalFollowsTheAtomicIncrementOutcome() {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), 1, 0));
        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.NOT_FOUND);

        // Deleted by someone else, not by a last download
        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(ShareNotFoundException.class);

        // The winner of the last slot deleted the record
        when(shareRegistry.wasExhausted(eq(TOKEN), any())).thenReturn(true);
        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(DownloadLimitReachedException.class);
        when(shareRegistry.wasExhausted(eq(TOKEN), any())).thenReturn(false);

        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.LIMIT_REACHED);
        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(DownloadLimitReachedException.class);

        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.EXPIRED);
        assertThatThrownBy(() -> gate.open(TOKEN)).isInstanceOf(ShareExpiredException.class);

        assertThat(transferLeases.holders(TOKEN)).isZero();
        assertThat(uploadDir.resolve(TOKEN + "-notes.txt")).exists();
    }

    @Test
    void continuingDownloadStreamsAndKeepsTheFile() throws IOException {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), null, 4));
        when(shareRegistry.incrementAndMaybeDelete(TOKEN, LocalDateTime.now(clock)))
                .thenReturn(DownloadOutcome.CONTINUING);

        DownloadTicket ticket = gate.open(TOKEN);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ticket.transferTo(out);

        assertThat(ticket.getOutcome()).isEqualTo(DownloadOutcome.CONTINUING);
        assertThat(ticket.getContentLength()).isEqualTo(CONTENT.length);
        assertThat(out.toByteArray()).isEqualTo(CONTENT);
        assertThat(uploadDir.resolve(TOKEN + "-notes.txt")).exists();
    }

    @Test
    void lastDownloadDeletesTheFileOnlyAfterTheBodyIsWritten() throws IOException {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), 1, 0));
        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.LAST_DOWNLOAD);
        Path file = uploadDir.resolve(TOKEN + "-notes.txt");

        DownloadTicket ticket = gate.open(TOKEN);
        assertThat(file).exists();

        ByteArrayOutputStream out = new ByteArrayOutputStream() {
            @Override
            public void flush() {
                // Still present while the body is being written
                assertThat(file).exists();
            }
        };
        ticket.transferTo(out);

        assertThat(out.toByteArray()).isEqualTo(CONTENT);
        assertThat(file).doesNotExist();
    }

    @Test
    void fileOutlivesTheLastDownloadWhileAnEarlierOneIsStillRunning() throws IOException {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), 2, 0));
        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any()))
                .thenReturn(DownloadOutcome.CONTINUING, DownloadOutcome.LAST_DOWNLOAD);
        Path file = uploadDir.resolve(TOKEN + "-notes.txt");

        DownloadTicket slow = gate.open(TOKEN);
        DownloadTicket last = gate.open(TOKEN);

        last.transferTo(new ByteArrayOutputStream());
        assertThat(file).exists();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        slow.transferTo(out);
        assertThat(out.toByteArray()).isEqualTo(CONTENT);
        assertThat(file).doesNotExist();
        assertThat(transferLeases.holders(TOKEN)).isZero();
    }

    @Test
    void lastDownloadFileIsRemovedEvenWhenTheClientAborts() {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), 1, 0));
        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.LAST_DOWNLOAD);

        DownloadTicket ticket = gate.open(TOKEN);
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }
        };

        assertThatThrownBy(() -> ticket.transferTo(broken)).isInstanceOf(IOException.class);
        assertThat(uploadDir.resolve(TOKEN + "-notes.txt")).doesNotExist();
    }

    @Test
    void grantedTicketStillStreamsAfterTheFileIsUnlinked() throws IOException {
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), null, 0));
        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.CONTINUING);

        DownloadTicket ticket = gate.open(TOKEN);
        Files.delete(uploadDir.resolve(TOKEN + "-notes.txt"));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ticket.transferTo(out);
        assertThat(out.toByteArray()).isEqualTo(CONTENT);
        assertThat(transferLeases.holders(TOKEN)).isZero();
    }

    @Test
    void missingFileIsNotFound() throws IOException {
        Files.delete(uploadDir.resolve(TOKEN + "-notes.txt"));
        when(shareRegistry.get(TOKEN)).thenReturn(share(Duration.ofDays(1), null, 0));
        when(shareRegistry.incrementAndMaybeDelete(eq(TOKEN), any())).thenReturn(DownloadOutcome.CONTINUING);

        assertThatThrownBy(() -> gate.open(TOKEN))
                .isInstanceOf(ShareNotFoundException.class)
                .hasMessage("File missing");
        assertThat(transferLeases.holders(TOKEN)).isZero();
    }

    private ShareRecord share(Duration remaining, Integer maxDownloads, int downloadCount) {
        LocalDateTime now = LocalDateTime.now(clock);
        return ShareRecord.builder()
                .id(1L)
                .token(TOKEN)
                .filename("notes.txt")
                .contentType("text/plain")
                .size(CONTENT.length)
                .createdAt(now.minusHours(1))
                .expiresAt(now.plus(remaining))
                .maxDownloads(maxDownloads)
                .downloadCount(downloadCount)
                .build();
    }
}
