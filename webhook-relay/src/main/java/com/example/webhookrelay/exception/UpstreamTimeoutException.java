package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

public class UpstreamTimeoutException extends WebhookRelayException {

    public UpstreamTimeoutException(Throwable cause) {
        super(HttpStatus.GATEWAY_TIMEOUT, "Cards service timeout", cause);
    }
}
