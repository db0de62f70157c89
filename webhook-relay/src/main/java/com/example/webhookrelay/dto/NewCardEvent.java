package com.example.webhookrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical new-card payload sent to the cards service create endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NewCardEvent {

    public static final String DEFAULT_PRIORITY = "STANDARD";

    String cardId;
    String customerId;
    String customerName;
    String mobileNumber;
    String panMasked;
    String applicationId;
    String priority;
    String address;
}
