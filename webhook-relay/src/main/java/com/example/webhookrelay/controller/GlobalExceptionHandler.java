package com.example.webhookrelay.controller;

import com.example.webhookrelay.exception.WebhookRelayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * The single place where relay failures become HTTP responses.
 * Every error body has the shape {@code {"detail": "..."}}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR_DETAIL = "Internal server error";

    @ExceptionHandler(WebhookRelayException.class)
    public ResponseEntity<Map<String, String>> handleRelayException(WebhookRelayException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("Webhook relay failed with {}: {}", e.getStatus().value(), e.getMessage());
        } else {
            log.warn("Webhook rejected with {}: {}", e.getStatus().value(), e.getMessage());
        }
        return buildErrorResponse(e.getStatus(), e.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return buildErrorResponse(HttpStatus.METHOD_NOT_ALLOWED, e.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e) {
        return buildErrorResponse(HttpStatus.UNSUPPORTED_MEDIA_TYPE, e.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NoResourceFoundException e) {
        return buildErrorResponse(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_DETAIL);
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
