package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

/**
 * Base exception for every failure the relay reports to a webhook caller.
 * Each subclass fixes the HTTP status it is translated to.
 */
public abstract class WebhookRelayException extends RuntimeException {

    private final HttpStatus status;

    protected WebhookRelayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected WebhookRelayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
