package com.example.webhookrelay.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness probe. Does not contact the cards service.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "webhook-relay";

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "service", SERVICE_NAME);
    }
}
