package com.linkdrop.api.controller;

import com.linkdrop.api.service.CallerAuthenticator;
import com.linkdrop.api.service.UploadPipeline;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

// Small read-only endpoints the web client calls on load
@RestController
public class ClientConfigController {

    private final CallerAuthenticator authenticator;
    private final UploadPipeline uploadPipeline;
    private final String title;
    private final String subtitle;

    public ClientConfigController(CallerAuthenticator authenticator,
                                  UploadPipeline uploadPipeline,
                                  @Value("${app.title:LinkDrop}") String title,
                                  @Value("${app.subtitle:Share files with expiring links}") String subtitle) {
        this.authenticator = authenticator;
        this.uploadPipeline = uploadPipeline;
        this.title = title;
        this.subtitle = subtitle;
    }

    // GET /auth/me
    @GetMapping("/auth/me")
    public Map<String, Boolean> me(HttpServletRequest request) {
        return Map.of("authenticated", authenticator.isAuthenticated(request));
    }

    // GET /api/config
    @GetMapping("/api/config")
    public Map<String, Object> config() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("title", title);
        config.put("subtitle", subtitle);
        config.put("max_upload_bytes", uploadPipeline.getMaxSize());
        return config;
    }
}
