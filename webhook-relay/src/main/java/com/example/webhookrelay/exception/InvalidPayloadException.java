package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when a webhook body cannot be decoded or parsed as a JSON object.
 */
public class InvalidPayloadException extends WebhookRelayException {

    public InvalidPayloadException(String message) {
        super(HttpStatus.BAD_REQUEST, "Invalid JSON payload: " + message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "Invalid JSON payload: " + message, cause);
    }
}
