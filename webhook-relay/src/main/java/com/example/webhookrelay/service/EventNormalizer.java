package com.example.webhookrelay.service;

import com.example.webhookrelay.dto.NewCardEvent;
import com.example.webhookrelay.dto.StatusUpdateEvent;
import com.example.webhookrelay.exception.MissingIdentifierException;
import com.example.webhookrelay.exception.MissingRequiredFieldException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the canonical event shapes from an arbitrary webhook payload.
 * Fields not listed here are dropped.
 */
@Component
public class EventNormalizer {

    static final String CARD_ID = "cardId";
    static final String APPLICATION_ID = "applicationId";

    private static final List<String> NEW_CARD_REQUIRED =
            List.of(CARD_ID, "customerId", "customerName", "mobileNumber");

    /**
     * Builds a {@link NewCardEvent}, rejecting the payload when any of the
     * four identity fields is missing or empty. All missing fields are reported.
     */
    public NewCardEvent normalizeNewCard(JsonNode input) {
        List<String> missing = new ArrayList<>();
        for (String field : NEW_CARD_REQUIRED) {
            if (isEmpty(text(input, field))) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldException(missing);
        }

        String priority = text(input, "priority");
        return NewCardEvent.builder()
                .cardId(text(input, CARD_ID))
                .customerId(text(input, "customerId"))
                .customerName(text(input, "customerName"))
                .mobileNumber(text(input, "mobileNumber"))
                .panMasked(text(input, "panMasked"))
                .applicationId(text(input, APPLICATION_ID))
                .priority(priority != null ? priority : NewCardEvent.DEFAULT_PRIORITY)
                .address(text(input, "address"))
                .build();
    }

    public StatusUpdateEvent normalizeStatusUpdate(JsonNode input) {
        JsonNode eventData = input.get("eventData");
        return StatusUpdateEvent.builder()
                .status(text(input, "status"))
                .source(text(input, "source"))
                .location(text(input, "location"))
                .operatorId(text(input, "operatorId"))
                .batchId(text(input, "batchId"))
                .message(text(input, "message"))
                .trackingId(text(input, "trackingId"))
                .failureReason(text(input, "failureReason"))
                .eventData(eventData != null && eventData.isObject() ? ((ObjectNode) eventData).deepCopy() : null)
                .build();
    }

    /**
     * Resolves the card identifier for a status update: {@code cardId}, or
     * {@code applicationId} when the source permits the fallback.
     */
    public String resolveIdentifier(JsonNode input, boolean allowApplicationIdFallback) {
        String cardId = text(input, CARD_ID);
        if (!isEmpty(cardId)) {
            return cardId;
        }
        if (allowApplicationIdFallback) {
            String applicationId = text(input, APPLICATION_ID);
            if (!isEmpty(applicationId)) {
                return applicationId;
            }
            throw new MissingIdentifierException("Missing cardId or applicationId");
        }
        throw new MissingIdentifierException("Missing cardId");
    }

    // Scalars keep their JSON text; nested containers are flattened to compact JSON.
    static String text(JsonNode input, String field) {
        JsonNode value = input.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    // whitespace-only values count as missing, matching CardsServiceClient
    static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
