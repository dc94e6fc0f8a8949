package com.linkdrop.api.service;

import com.linkdrop.api.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemStorageServiceTest {

    private static final byte[] CONTENT = "stored bytes".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private FileSystemStorageService storage;

    @BeforeEach
    void setUp() {
        storage = new FileSystemStorageService(root.resolve("uploads").toString());
    }

    @Test
    void createsTheUploadDirectory() {
        assertThat(root.resolve("uploads")).isDirectory();
    }

    @Test
    void partialFileIsPromotedUnderTokenAndName() throws IOException {
        try (OutputStream out = storage.createPartial("up-1")) {
            out.write(CONTENT);
        }

        Path promoted = storage.promotePartial("up-1", "tok", "report.pdf");

        assertThat(promoted.getFileName().toString()).isEqualTo("tok-report.pdf");
        assertThat(Files.exists(storage.resolve("tok", "report.pdf"))).isTrue();
        assertThat(storage.size("tok", "report.pdf")).isEqualTo(CONTENT.length);
        try (InputStream in = storage.open("tok", "report.pdf")) {
            assertThat(in.readAllBytes()).isEqualTo(CONTENT);
        }
        assertThat(root.resolve("uploads").resolve(FileSystemStorageService.PARTIAL_PREFIX + "up-1")).doesNotExist();
    }

    @Test
    void overlongNameIsShortenedRatherThanFailingThePromotion() throws IOException {
        String longName = "quarterly-".repeat(30) + "report.pdf";
        try (OutputStream out = storage.createPartial("up-3")) {
            out.write(CONTENT);
        }

        Path promoted = storage.promotePartial("up-3", "Aq3xY9bT2mK8wZ5nR1cV0e", longName);

        assertThat(promoted.getFileName().toString()).startsWith("Aq3xY9bT2mK8wZ5nR1cV0e-quarterly-").endsWith(".pdf");
        assertThat(promoted.getFileName().toString().length()).isLessThanOrEqualTo(255);
        try (InputStream in = storage.open("Aq3xY9bT2mK8wZ5nR1cV0e", longName)) {
            assertThat(in.readAllBytes()).isEqualTo(CONTENT);
        }
    }

    @Test
    void partialFileCannotBeOpenedTwice() throws IOException {
        storage.createPartial("up-2").close();

        assertThatThrownBy(() -> storage.createPartial("up-2")).isInstanceOf(FileAlreadyExistsException.class);
        assertThat(storage.deletePartial("up-2")).isTrue();
        assertThat(storage.deletePartial("up-2")).isFalse();
    }

    @Test
    void directoryPartsOfTheNameNeverLeaveTheUploadDirectory() {
        Path path = storage.resolve("tok", "../../etc/passwd");

        assertThat(path.getParent()).isEqualTo(root.resolve("uploads").toAbsolutePath().normalize());
        assertThat(path.getFileName().toString()).isEqualTo("tok-passwd");
    }

    @Test
    void tokenCannotEscapeTheUploadDirectory() {
        assertThatThrownBy(() -> storage.resolve("../outside", "a.txt")).isInstanceOf(StorageException.class);
    }

    @Test
    void deletingAMissingFileReportsFalse() throws IOException {
        Files.write(storage.resolve("tok", "a.txt"), CONTENT);

        assertThat(storage.deleteIfExists("tok", "a.txt")).isTrue();
        assertThat(storage.deleteIfExists("tok", "a.txt")).isFalse();
        assertThat(Files.exists(storage.resolve("tok", "a.txt"))).isFalse();
    }
}
