package com.linkdrop.api.service;

import com.linkdrop.api.exception.StorageException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

@Service
public class FileSystemStorageService implements StorageService {

    private static final int BUFFER_SIZE = 65536;
    static final String PARTIAL_PREFIX = ".partial-";

    private final Path rootLocation; // The folder path: ./uploads

    public FileSystemStorageService(@Value("${app.storage.location}") String storageLocation) {
        this.rootLocation = Paths.get(storageLocation).toAbsolutePath().normalize();
        init(); // Ensure the folder exists
    }

    private void init() {
        try {
            Files.createDirectories(rootLocation);
        } catch (IOException e) {
            throw new StorageException("Could not initialize storage location", e);
        }
    }

    @Override
    public Path resolve(String token, String filename) {
        // ./uploads/<token>-<name>
        Path path = rootLocation.resolve(token + "-" + FilenameSanitizer.sanitize(filename)).normalize();
        if (!rootLocation.equals(path.getParent())) {
            throw new StorageException("Refusing to resolve a path outside the upload directory");
        }
        return path;
    }

    Path resolvePartial(String uploadId) {
        Path path = rootLocation.resolve(PARTIAL_PREFIX + uploadId).normalize();
        if (!rootLocation.equals(path.getParent())) {
            throw new StorageException("Refusing to resolve a path outside the upload directory");
        }
        return path;
    }

    @Override
    public OutputStream createPartial(String uploadId) throws IOException {
        return new BufferedOutputStream(
                Files.newOutputStream(resolvePartial(uploadId), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE),
                BUFFER_SIZE);
    }

    @Override
    public Path promotePartial(String uploadId, String token, String filename) throws IOException {
        Path target = resolve(token, filename);
        // Same directory, a plain rename
        return Files.move(resolvePartial(uploadId), target, StandardCopyOption.ATOMIC_MOVE);
    }

    @Override
    public boolean deletePartial(String uploadId) throws IOException {
        return Files.deleteIfExists(resolvePartial(uploadId));
    }

    @Override
    public InputStream open(String token, String filename) throws IOException {
        return new BufferedInputStream(Files.newInputStream(resolve(token, filename)), BUFFER_SIZE);
    }

    @Override
    public long size(String token, String filename) throws IOException {
        return Files.size(resolve(token, filename));
    }

    @Override
    public boolean deleteIfExists(String token, String filename) throws IOException {
        return Files.deleteIfExists(resolve(token, filename));
    }
}
