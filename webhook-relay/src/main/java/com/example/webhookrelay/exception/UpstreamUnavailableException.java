package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

public class UpstreamUnavailableException extends WebhookRelayException {

    public UpstreamUnavailableException(Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "Cards service unavailable", cause);
    }
}
