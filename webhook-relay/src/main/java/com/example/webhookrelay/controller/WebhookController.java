package com.example.webhookrelay.controller;

import com.example.webhookrelay.dto.WebhookSource;
import com.example.webhookrelay.service.WebhookRelayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Inbound webhook endpoints for the bank, the card manufacturer and the logistics provider.
 *
 * Bodies are taken as raw bytes so that payloads with typographic quotes can be
 * repaired before JSON parsing.
 */
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookRelayService webhookRelayService;

    /**
     * Bank pushes new card applications.
     */
    @PostMapping("/bank/new")
    public Mono<ResponseEntity<Map<String, Object>>> bankNewCard(@RequestBody(required = false) byte[] body) {
        return relay(WebhookSource.BANK_NEW, body);
    }

    /**
     * Bank pushes updates for existing cards.
     */
    @PostMapping("/bank/update")
    public Mono<ResponseEntity<Map<String, Object>>> bankUpdate(@RequestBody(required = false) byte[] body) {
        return relay(WebhookSource.BANK_UPDATE, body);
    }

    @PostMapping("/card-manufacturer")
    public Mono<ResponseEntity<Map<String, Object>>> manufacturerUpdate(@RequestBody(required = false) byte[] body) {
        return relay(WebhookSource.MANUFACTURER, body);
    }

    @PostMapping("/logistics")
    public Mono<ResponseEntity<Map<String, Object>>> logisticsUpdate(@RequestBody(required = false) byte[] body) {
        return relay(WebhookSource.LOGISTICS, body);
    }

    private Mono<ResponseEntity<Map<String, Object>>> relay(WebhookSource source, byte[] body) {
        return webhookRelayService.relay(source, body).map(ResponseEntity::ok);
    }
}
