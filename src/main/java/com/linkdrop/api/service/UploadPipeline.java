package com.linkdrop.api.service;

import com.linkdrop.api.exception.InvalidShareRequestException;
import com.linkdrop.api.exception.ShareException;
import com.linkdrop.api.exception.StorageException;
import com.linkdrop.api.exception.UploadTooLargeException;
import com.linkdrop.api.model.ShareRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Streams an upload into a partial file under the size ceiling and turns it into a share.
 */
@Slf4j
@Service
public class UploadPipeline {

    private static final Pattern UPLOAD_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final StorageService storageService;
    private final ShareRegistry shareRegistry;
    private final UploadProgressStore progressStore;
    private final long maxSize;
    private final int chunkSize;

    public UploadPipeline(StorageService storageService,
                          ShareRegistry shareRegistry,
                          UploadProgressStore progressStore,
                          @Value("${app.upload.max-size:100MB}") DataSize maxSize,
                          @Value("${app.upload.chunk-size:1MB}") DataSize chunkSize) {
        this.storageService = storageService;
        this.shareRegistry = shareRegistry;
        this.progressStore = progressStore;
        this.maxSize = maxSize.toBytes();
        this.chunkSize = Math.toIntExact(chunkSize.toBytes());
    }

    public long getMaxSize() {
        return maxSize;
    }

    public UploadReceipt upload(UploadCommand command, InputStream in) {
        if (command.getFilename() == null || command.getFilename().isBlank()) {
            throw new InvalidShareRequestException("No file");
        }
        if (command.getTtl() == null || command.getTtl().isNegative() || command.getTtl().isZero()) {
            throw new InvalidShareRequestException("Expiration must be in the future");
        }
        String uploadId = resolveUploadId(command.getUploadId());
        long declared = command.getDeclaredLength() == null ? 0 : command.getDeclaredLength();
        if (!progressStore.start(uploadId, declared)) {
            throw new InvalidShareRequestException("Upload id already in use");
        }

        // Fail fast before reading a single byte
        if (declared > maxSize) {
            progressStore.fail(uploadId);
            throw new UploadTooLargeException(maxSize);
        }

        try {
            long written = copyToPartial(uploadId, in);
            // No record until every byte is on disk
            ShareRecord share = shareRegistry.create(command.getFilename(), command.getTtl(),
                    command.getMaxDownloads(), written, command.getContentType());
            promote(uploadId, share);
            progressStore.complete(uploadId, written);
            return new UploadReceipt(uploadId, share);
        } catch (ShareException e) {
            abort(uploadId);
            throw e;
        } catch (IOException | RuntimeException e) {
            abort(uploadId);
            throw new StorageException("Upload " + uploadId + " failed", e);
        }
    }

    private long copyToPartial(String uploadId, InputStream in) throws IOException {
        byte[] chunk = new byte[chunkSize];
        long total = 0;
        try (OutputStream out = storageService.createPartial(uploadId)) {
            int read;
            while ((read = in.readNBytes(chunk, 0, chunk.length)) > 0) {
                total += read;
                // The running count decides, not the announced length
                if (total > maxSize) {
                    throw new UploadTooLargeException(maxSize);
                }
                out.write(chunk, 0, read);
                progressStore.advance(uploadId, total);
            }
        }
        return total;
    }

    private void promote(String uploadId, ShareRecord share) throws IOException {
        try {
            storageService.promotePartial(uploadId, share.getToken(), share.getFilename());
        } catch (IOException | RuntimeException e) {
            shareRegistry.deleteById(share.getId());
            throw e;
        }
    }

    private void abort(String uploadId) {
        progressStore.fail(uploadId);
        try {
            storageService.deletePartial(uploadId);
        } catch (IOException e) {
            log.warn("Could not remove partial file of upload {}: {}", uploadId, e.getClass().getSimpleName());
        }
    }

    private String resolveUploadId(String requested) {
        if (requested == null || requested.isBlank()) {
            return UUID.randomUUID().toString();
        }
        if (!UPLOAD_ID.matcher(requested).matches()) {
            throw new InvalidShareRequestException("Invalid upload id");
        }
        return requested;
    }
}
