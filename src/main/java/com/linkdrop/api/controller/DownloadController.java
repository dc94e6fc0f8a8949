package com.linkdrop.api.controller;

import com.linkdrop.api.service.DownloadGate;
import com.linkdrop.api.service.DownloadTicket;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.charset.StandardCharsets;

@RestController
public class DownloadController {

    private final DownloadGate downloadGate;

    public DownloadController(DownloadGate downloadGate) {
        this.downloadGate = downloadGate;
    }

    // Public share link, no authentication
    // GET /share/{token}
    @GetMapping("/share/{token}")
    public ResponseEntity<StreamingResponseBody> downloadFile(@PathVariable String token) {
        // Refusals (404 / 410) are thrown from here, before any byte is written
        DownloadTicket ticket = downloadGate.open(token);

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(ticket.getFilename(), StandardCharsets.UTF_8)
                .build();

        // The ticket deletes the file of a last download only after the body is written
        StreamingResponseBody body = ticket::transferTo;
        return ResponseEntity.ok()
                // "attachment" forces the browser to download instead of opening
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(mediaTypeOf(ticket))
                .contentLength(ticket.getContentLength())
                .body(body);
    }

    private MediaType mediaTypeOf(DownloadTicket ticket) {
        if (ticket.getContentType() == null) {
            return guessFromName(ticket.getFilename());
        }
        try {
            return MediaType.parseMediaType(ticket.getContentType());
        } catch (InvalidMediaTypeException e) {
            return guessFromName(ticket.getFilename());
        }
    }

    private MediaType guessFromName(String filename) {
        return MediaTypeFactory.getMediaType(filename).orElse(MediaType.APPLICATION_OCTET_STREAM);
    }
}
