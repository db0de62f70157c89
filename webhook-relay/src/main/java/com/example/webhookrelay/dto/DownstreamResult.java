package com.example.webhookrelay.dto;

import lombok.Value;

/**
 * Raw status code and body returned by the cards service.
 */
@Value
public class DownstreamResult {

    int statusCode;
    String body;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
