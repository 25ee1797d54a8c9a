package com.clientsync.controller;

import com.clientsync.service.ClientSyncService;
import com.clientsync.service.SyncStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class HealthController {

    private static final String VERSION = "1.0.0";

    private final SyncStatsService syncStatsService;
    private final ClientSyncService clientSyncService;

    @GetMapping("/")
    public Mono<Map<String, String>> root() {
        return Mono.just(Map.of(
            "service", "ClientSync",
            "version", VERSION
        ));
    }

    @GetMapping("/v1/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(() -> Map.of(
            "status", syncStatsService.isHealthy() ? "healthy" : "degraded",
            "syncInProgress", clientSyncService.isSyncInProgress(),
            "version", VERSION
        ));
    }
}
