package com.example.webhookrelay.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Connection settings for the downstream cards service.
 * Bound once at startup from {@code relay.cards.*} and never mutated.
 */
@Getter
@ConfigurationProperties(prefix = "relay.cards")
public class CardsServiceProperties {

    public static final String DEFAULT_BASE_URL = "http://localhost:3001/api/v1/cards";

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public CardsServiceProperties(@DefaultValue(DEFAULT_BASE_URL) String baseUrl,
            @DefaultValue("") String apiKey,
            @DefaultValue("30s") Duration timeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
