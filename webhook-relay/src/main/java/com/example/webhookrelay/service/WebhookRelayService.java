package com.example.webhookrelay.service;

import com.example.webhookrelay.dto.DownstreamResult;
import com.example.webhookrelay.dto.NewCardEvent;
import com.example.webhookrelay.dto.StatusUpdateEvent;
import com.example.webhookrelay.dto.WebhookSource;
import com.example.webhookrelay.exception.DownstreamRejectedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a webhook through parse, normalize and forward, producing the success body
 * for the caller. Any failure is left to propagate as a typed exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRelayService {

    public static final String SOURCE_MDC_KEY = "source";
    public static final String CARD_ID_MDC_KEY = "cardId";

    private static final List<String> REDACTED_FIELDS = List.of("mobileNumber", "address");

    private final PayloadParser payloadParser;
    private final EventNormalizer eventNormalizer;
    private final CardsServiceClient cardsServiceClient;

    public Mono<Map<String, Object>> relay(WebhookSource source, byte[] body) {
        return Mono.defer(() -> {
            MDC.put(SOURCE_MDC_KEY, source.name());
            JsonNode payload = payloadParser.parse(body);
            log.info("Webhook received: {} {}", source.getLabel(), redacted(payload));

            if (source == WebhookSource.BANK_NEW) {
                NewCardEvent event = eventNormalizer.normalizeNewCard(payload);
                MDC.put(CARD_ID_MDC_KEY, event.getCardId());
                return respond(source, event.getCardId(), cardsServiceClient.forwardNewCard(event));
            }

            String cardId = eventNormalizer.resolveIdentifier(payload, source.allowsApplicationIdFallback());
            MDC.put(CARD_ID_MDC_KEY, cardId);
            StatusUpdateEvent event = eventNormalizer.normalizeStatusUpdate(payload);
            return respond(source, cardId, cardsServiceClient.forwardStatusUpdate(cardId, event));
        }).doFinally(signal -> MDC.clear());
    }

    private Mono<Map<String, Object>> respond(WebhookSource source, String cardId, Mono<DownstreamResult> forwarded) {
        // callbacks may run on a reactor-netty thread
        Map<String, String> logContext = MDC.getCopyOfContextMap();

        return forwarded.map(result -> {
            restoreMdc(logContext);
            if (!result.isSuccessful()) {
                log.warn("{} for card {} rejected by cards service with status {}",
                        source.getLabel(), cardId, result.getStatusCode());
                throw new DownstreamRejectedException(result.getStatusCode());
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "success");
            response.put("message", source.getSuccessMessage());
            response.put("cardId", cardId);
            response.put("forwarded_status", result.getStatusCode());
            return response;
        });
    }

    static void restoreMdc(Map<String, String> logContext) {
        if (logContext != null) {
            MDC.setContextMap(logContext);
        }
    }

    private static JsonNode redacted(JsonNode payload) {
        ObjectNode copy = ((ObjectNode) payload).deepCopy();
        for (String field : REDACTED_FIELDS) {
            if (copy.hasNonNull(field)) {
                copy.put(field, "***");
            }
        }
        return copy;
    }
}
