package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

/**
 * Transport failure other than a timeout or refused connection.
 */
public class ForwardException extends WebhookRelayException {

    public ForwardException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "Forwarding error: " + message, cause);
    }
}
