package com.rankbox.api.controller;

import com.rankbox.api.service.RankingSessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "API health and status")
public class HealthController {

    private final RankingSessionService sessionService;

    public HealthController(RankingSessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check the API and whether a session is running")
    public Map<String, Object> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());
        health.put("activeSession", sessionService.hasSession());
        health.put("comparisons", sessionService.getComparisons());
        return health;
    }
}
