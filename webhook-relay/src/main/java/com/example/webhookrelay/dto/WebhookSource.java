package com.example.webhookrelay.dto;

/**
 * External party and event kind behind each webhook route.
 */
public enum WebhookSource {

    BANK_NEW("Bank new card", "New card forwarded to cards service", false),
    BANK_UPDATE("Bank card update", "Bank update forwarded to cards service", false),
    MANUFACTURER("Manufacturer update", "Manufacturer update forwarded to cards service", true),
    LOGISTICS("Logistics update", "Logistics update forwarded to cards service", true);

    private final String label;
    private final String successMessage;
    private final boolean applicationIdFallback;

    WebhookSource(String label, String successMessage, boolean applicationIdFallback) {
        this.label = label;
        this.successMessage = successMessage;
        this.applicationIdFallback = applicationIdFallback;
    }

    public String getLabel() {
        return label;
    }

    public String getSuccessMessage() {
        return successMessage;
    }

    /**
     * Whether {@code applicationId} may stand in for a missing {@code cardId}.
     */
    public boolean allowsApplicationIdFallback() {
        return applicationIdFallback;
    }
}
