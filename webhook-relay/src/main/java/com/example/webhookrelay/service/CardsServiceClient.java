package com.example.webhookrelay.service;

import com.example.webhookrelay.config.CardsServiceProperties;
import com.example.webhookrelay.dto.DownstreamResult;
import com.example.webhookrelay.dto.NewCardEvent;
import com.example.webhookrelay.dto.StatusUpdateEvent;
import com.example.webhookrelay.exception.ForwardException;
import com.example.webhookrelay.exception.MissingIdentifierException;
import com.example.webhookrelay.exception.UpstreamTimeoutException;
import com.example.webhookrelay.exception.UpstreamUnavailableException;
import com.example.webhookrelay.exception.WebhookRelayException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the downstream cards service.
 *
 * Every call is bounded by the configured timeout and is attempted exactly once.
 * Non-2xx answers are returned as a {@link DownstreamResult}; only transport
 * failures surface as errors.
 */
@Service
@Slf4j
public class CardsServiceClient {

    public static final String API_KEY_HEADER = "X-API-Key";

    static final String OPERATION_CREATE = "create";
    static final String OPERATION_STATUS = "status";

    private final WebClient webClient;
    private final CardsServiceProperties properties;
    private final MeterRegistry meterRegistry;

    public CardsServiceClient(WebClient webClient,
            CardsServiceProperties properties,
            MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * POST the new card to {@code {baseUrl}}.
     */
    public Mono<DownstreamResult> forwardNewCard(NewCardEvent event) {
        log.info("Forwarding new card to cards service: cardId={}", event.getCardId());

        WebClient.RequestHeadersSpec<?> request = webClient.post()
                .uri(properties.getBaseUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(event);

        return exchange(OPERATION_CREATE, request);
    }

    /**
     * POST a status update to {@code {baseUrl}/{cardId}/status} with the shared secret header.
     */
    public Mono<DownstreamResult> forwardStatusUpdate(String cardId, StatusUpdateEvent event) {
        if (cardId == null || cardId.isBlank()) {
            return Mono.error(new MissingIdentifierException("Missing card identifier for status update"));
        }

        log.info("Forwarding status update to cards service: cardId={}, status={}", cardId, event.getStatus());

        WebClient.RequestBodySpec request = webClient.post()
                .uri(properties.getBaseUrl() + "/{cardId}/status", cardId)
                .contentType(MediaType.APPLICATION_JSON);
        if (properties.hasApiKey()) {
            request = request.header(API_KEY_HEADER, properties.getApiKey());
        } else {
            log.warn("No cards service API key configured; sending status update for {} without {}",
                    cardId, API_KEY_HEADER);
        }

        return exchange(OPERATION_STATUS, request.bodyValue(event));
    }

    private Mono<DownstreamResult> exchange(String operation, WebClient.RequestHeadersSpec<?> request) {
        Map<String, String> logContext = MDC.getCopyOfContextMap();

        return Mono.fromCallable(System::nanoTime)
                .flatMap(startTime -> request
                        .exchangeToMono(response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new DownstreamResult(response.statusCode().value(), body)))
                        .timeout(properties.getTimeout())
                        .doOnNext(result -> {
                            WebhookRelayService.restoreMdc(logContext);
                            record(operation, startTime, result);
                        })
                        .onErrorMap(error -> {
                            WebhookRelayService.restoreMdc(logContext);
                            return translate(operation, startTime, error);
                        }));
    }

    private void record(String operation, long startTime, DownstreamResult result) {
        long duration = System.nanoTime() - startTime;
        timer(operation).record(Duration.ofNanos(duration));

        if (result.isSuccessful()) {
            counter("relay.forward.success", operation).increment();
            log.info("Cards service accepted {} request: status={}, durationMs={}",
                    operation, result.getStatusCode(), duration / 1_000_000);
        } else {
            counter("relay.forward.failure", operation).increment();
            log.warn("Cards service rejected {} request: status={}, body={}",
                    operation, result.getStatusCode(), result.getBody());
        }
    }

    private Throwable translate(String operation, long startTime, Throwable error) {
        counter("relay.forward.failure", operation).increment();
        long durationMs = (System.nanoTime() - startTime) / 1_000_000;

        if (error instanceof WebhookRelayException) {
            return error;
        }
        if (hasCause(error, ConnectException.class)
                || hasCause(error, UnknownHostException.class)
                || hasCause(error, NoRouteToHostException.class)) {
            log.error("Cards service unreachable for {} request after {}ms: {}", operation, durationMs, error.getMessage());
            return new UpstreamUnavailableException(error);
        }
        if (hasCause(error, TimeoutException.class)
                || hasCause(error, io.netty.handler.timeout.TimeoutException.class)) {
            log.error("Cards service timed out for {} request after {}ms", operation, durationMs);
            return new UpstreamTimeoutException(error);
        }

        log.error("Error forwarding {} request to cards service", operation, error);
        return new ForwardException(error.getMessage(), error);
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private Counter counter(String name, String operation) {
        return Counter.builder(name)
                .description("Webhook events forwarded to the cards service")
                .tag("operation", operation)
                .register(meterRegistry);
    }

    private Timer timer(String operation) {
        return Timer.builder("relay.forward.duration")
                .description("Time taken for cards service calls")
                .tag("operation", operation)
                .register(meterRegistry);
    }
}
