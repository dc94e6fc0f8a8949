package com.linkdrop.api.controller;

import com.linkdrop.api.exception.ErrorCategory;
import com.linkdrop.api.exception.ShareException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Turns failures into {@code {"detail": "..."}} bodies. Internal failures are logged by category and exception type
 * only and reach the client as a generic message.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String INTERNAL_MESSAGE = "Internal error";

    @ExceptionHandler(ShareException.class)
    public ResponseEntity<Map<String, String>> handleShareException(ShareException e) {
        ErrorCategory category = e.getCategory();
        if (category == ErrorCategory.INTERNAL_FAILURE) {
            return internalFailure(e);
        }
        return detail(category.getStatus(), e.getMessage());
    }

    // Spring's own multipart limit, hit before the upload pipeline sees the request
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleMaxUploadSize(MaxUploadSizeExceededException e) {
        return detail(ErrorCategory.TOO_LARGE.getStatus(), "File exceeds the maximum upload size");
    }

    @ExceptionHandler({
            MissingServletRequestPartException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        return detail(HttpStatus.BAD_REQUEST, "Invalid request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            // Framework errors such as unknown routes or wrong methods keep their status
            ErrorResponse response = (ErrorResponse) e;
            HttpStatusCode status = response.getStatusCode();
            if (status.is4xxClientError()) {
                String message = response.getBody().getDetail();
                return detail(status, message != null ? message : "Request failed");
            }
        }
        return internalFailure(e);
    }

    private ResponseEntity<Map<String, String>> internalFailure(Exception e) {
        log.error("{} ({})", ErrorCategory.INTERNAL_FAILURE, e.getClass().getSimpleName());
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_MESSAGE);
    }

    private ResponseEntity<Map<String, String>> detail(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
