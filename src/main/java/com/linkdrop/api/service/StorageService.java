package com.linkdrop.api.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Backing files of shares. A finished file is addressed by the share's token and sanitized filename; an upload in
 * progress writes to a partial file keyed by its upload id until it is promoted.
 */
public interface StorageService {

    // 1. Where the bytes of a share live
    Path resolve(String token, String filename);

    // 2. Fresh partial file for an upload in progress; fails if one already exists
    OutputStream createPartial(String uploadId) throws IOException;

    // 3. Moves a fully written partial file to its share path
    Path promotePartial(String uploadId, String token, String filename) throws IOException;

    boolean deletePartial(String uploadId) throws IOException;

    // 4. The actual bytes for downloading
    InputStream open(String token, String filename) throws IOException;

    long size(String token, String filename) throws IOException;

    /**
     * Removes the file if present.
     *
     * @return false when there was nothing to delete
     */
    boolean deleteIfExists(String token, String filename) throws IOException;
}
