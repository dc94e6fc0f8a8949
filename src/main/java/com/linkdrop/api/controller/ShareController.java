package com.linkdrop.api.controller;

import com.linkdrop.api.exception.InvalidShareRequestException;
import com.linkdrop.api.exception.ShareNotFoundException;
import com.linkdrop.api.exception.UnauthenticatedException;
import com.linkdrop.api.model.ShareCreatedResponse;
import com.linkdrop.api.model.ShareSummary;
import com.linkdrop.api.model.UploadProgress;
import com.linkdrop.api.service.CallerAuthenticator;
import com.linkdrop.api.service.ShareService;
import com.linkdrop.api.service.UploadCommand;
import com.linkdrop.api.service.UploadPipeline;
import com.linkdrop.api.service.UploadProgressStore;
import com.linkdrop.api.service.UploadReceipt;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ShareController {

    static final int MAX_DOWNLOADS_LIMIT = 1000;
    static final int MAX_EXPIRATION_DAYS = 30;

    private final UploadPipeline uploadPipeline;
    private final UploadProgressStore progressStore;
    private final ShareService shareService;
    private final CallerAuthenticator authenticator;

    public ShareController(UploadPipeline uploadPipeline,
                           UploadProgressStore progressStore,
                           ShareService shareService,
                           CallerAuthenticator authenticator) {
        this.uploadPipeline = uploadPipeline;
        this.progressStore = progressStore;
        this.shareService = shareService;
        this.authenticator = authenticator;
    }

    // 1. Upload Endpoint
    // POST /api/upload
    // Body: form-data key="file", "max_downloads" (optional), "expiration_days" (default 1), "upload_id" (optional)
    @PostMapping("/upload")
    public ResponseEntity<ShareCreatedResponse> uploadFile(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "max_downloads", required = false) Integer maxDownloads,
            @RequestParam(value = "expiration_days", defaultValue = "1") int expirationDays,
            @RequestParam(value = "upload_id", required = false) String uploadId,
            HttpServletRequest request) throws IOException {
        requireAuthenticated(request);

        if (maxDownloads != null && (maxDownloads < 1 || maxDownloads > MAX_DOWNLOADS_LIMIT)) {
            throw new InvalidShareRequestException("max_downloads must be between 1 and " + MAX_DOWNLOADS_LIMIT);
        }
        if (expirationDays < 1 || expirationDays > MAX_EXPIRATION_DAYS) {
            throw new InvalidShareRequestException("expiration_days must be between 1 and " + MAX_EXPIRATION_DAYS);
        }

        UploadCommand command = UploadCommand.builder()
                .uploadId(uploadId)
                .filename(file.getOriginalFilename())
                .contentType(file.getContentType())
                .declaredLength(file.getSize())
                .ttl(Duration.ofDays(expirationDays))
                .maxDownloads(maxDownloads)
                .build();

        UploadReceipt receipt;
        try (InputStream in = file.getInputStream()) {
            receipt = uploadPipeline.upload(command, in);
        }
        return ResponseEntity.ok(ShareCreatedResponse.from(receipt.getShare(), receipt.getUploadId()));
    }

    // GET /api/upload/progress/{uploadId}
    @GetMapping("/upload/progress/{uploadId}")
    public UploadProgress uploadProgress(@PathVariable String uploadId, HttpServletRequest request) {
        requireAuthenticated(request);
        return progressStore.find(uploadId)
                .orElseThrow(() -> new ShareNotFoundException("Unknown upload"));
    }

    // 2. Active shares of this instance
    // GET /api/files
    @GetMapping("/files")
    public List<ShareSummary> listFiles(HttpServletRequest request) {
        requireAuthenticated(request);
        return shareService.listActive().stream()
                .map(ShareSummary::from)
                .toList();
    }

    // DELETE /api/files/{id}
    @DeleteMapping("/files/{id}")
    public Map<String, Boolean> deleteFile(@PathVariable Long id, HttpServletRequest request) {
        requireAuthenticated(request);
        shareService.delete(id);
        return Map.of("ok", true);
    }

    private void requireAuthenticated(HttpServletRequest request) {
        if (!authenticator.isAuthenticated(request)) {
            throw new UnauthenticatedException("Auth required");
        }
    }
}
