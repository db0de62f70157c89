package com.example.webhookrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical status update sent to {@code {baseUrl}/{cardId}/status}.
 * Every field is optional; absent fields are left out of the JSON body.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusUpdateEvent {

    String status;
    String source;
    String location;
    String operatorId;
    String batchId;
    String message;
    String trackingId;
    String failureReason;
    ObjectNode eventData;
}
