package com.example.webhookrelay.config;

import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {

    private final WebClientConfig webClientConfig = new WebClientConfig();

    @Test
    void cardsServiceWebClient_DefaultTimeout_ShouldBuild() {
        CardsServiceProperties properties = new CardsServiceProperties(
                "http://localhost:3001/api/v1/cards", "", Duration.ofSeconds(30));

        assertNotNull(webClientConfig.cardsServiceWebClient(WebClient.builder(), properties));
    }

    @Test
    void cardsServiceWebClient_TimeoutBeyondIntMillis_ShouldFailInsteadOfWrapping() {
        CardsServiceProperties properties = new CardsServiceProperties(
                "http://localhost:3001/api/v1/cards", "", Duration.ofDays(30));

        assertThrows(ArithmeticException.class,
                () -> webClientConfig.cardsServiceWebClient(WebClient.builder(), properties));
    }
}
