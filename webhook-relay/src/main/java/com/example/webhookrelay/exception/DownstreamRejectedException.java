package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when the cards service answers outside the 2xx range.
 */
public class DownstreamRejectedException extends WebhookRelayException {

    private final int downstreamStatus;

    public DownstreamRejectedException(int downstreamStatus) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "Cards service error: " + downstreamStatus);
        this.downstreamStatus = downstreamStatus;
    }

    public int getDownstreamStatus() {
        return downstreamStatus;
    }
}
