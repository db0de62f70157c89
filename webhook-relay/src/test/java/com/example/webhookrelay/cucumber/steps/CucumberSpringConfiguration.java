package com.example.webhookrelay.cucumber.steps;

import io.cucumber.java.AfterAll;
import io.cucumber.spring.CucumberContextConfiguration;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;

@CucumberContextConfiguration
@SpringBootTest(classes = com.example.webhookrelay.WebhookRelayApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("test")
public class CucumberSpringConfiguration {

    static final MockWebServer CARDS_SERVICE = new MockWebServer();
    static final AtomicInteger CARDS_SERVICE_STATUS = new AtomicInteger(200);

    static {
        CARDS_SERVICE.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse()
                        .setResponseCode(CARDS_SERVICE_STATUS.get())
                        .setHeader("Content-Type", "application/json")
                        .setBody("{\"success\":true}");
            }
        });
        try {
            CARDS_SERVICE.start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @AfterAll
    public static void stopCardsService() throws IOException {
        CARDS_SERVICE.shutdown();
    }

    @DynamicPropertySource
    static void cardsServiceProperties(DynamicPropertyRegistry registry) {
        registry.add("relay.cards.base-url", () -> CARDS_SERVICE.url("/api/v1/cards").toString());
    }
}
