package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when no card identifier can be resolved for a status update.
 */
public class MissingIdentifierException extends WebhookRelayException {

    public MissingIdentifierException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
