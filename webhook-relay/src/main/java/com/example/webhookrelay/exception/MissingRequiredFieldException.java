package com.example.webhookrelay.exception;

import org.springframework.http.HttpStatus;

import java.util.List;

/**
 * Thrown when a new card event lacks one or more mandatory fields.
 */
public class MissingRequiredFieldException extends WebhookRelayException {

    private final List<String> missingFields;

    public MissingRequiredFieldException(List<String> missingFields) {
        super(HttpStatus.BAD_REQUEST, "Missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
