package com.clientsync.controller;

import com.clientsync.exception.ResourceNotFoundException;
import com.clientsync.model.dto.SyncStatsResponse;
import com.clientsync.model.dto.UpsertResponse;
import com.clientsync.model.entity.Client;
import com.clientsync.model.sync.SyncKind;
import com.clientsync.model.sync.SyncRun;
import com.clientsync.repository.ClientRepository;
import com.clientsync.service.ClientSyncService;
import com.clientsync.service.SyncScheduler;
import com.clientsync.service.SyncStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Admin endpoints for triggering and inspecting client sync.
 */
@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class SyncAdminController {

    private final SyncScheduler syncScheduler;
    private final ClientSyncService clientSyncService;
    private final SyncStatsService syncStatsService;
    private final ClientRepository clientRepository;

    /**
     * Run a pass now and return its counters. Answers 409 while another pass runs.
     */
    @PostMapping("/sync/trigger")
    public Mono<SyncRun> trigger(
            @RequestParam(value = "kind", required = false) String kind,
            @RequestParam(value = "since", required = false) Instant since) {
        return Mono.defer(() -> syncScheduler.trigger(SyncKind.fromValue(kind), since));
    }

    @GetMapping("/sync/status")
    public Mono<SyncStatsResponse> status() {
        return Mono.fromCallable(() -> {
            SyncStatsResponse stats = syncStatsService.getStats();
            stats.setSyncInProgress(clientSyncService.isSyncInProgress());
            return stats;
        });
    }

    @GetMapping("/sync/health")
    public Mono<Map<String, Boolean>> health() {
        return Mono.fromCallable(() -> Map.of("healthy", syncStatsService.isHealthy()));
    }

    @PostMapping("/sync/cancel")
    public Mono<Map<String, Boolean>> cancel() {
        return Mono.fromCallable(() -> Map.of("cancelled", clientSyncService.cancelCurrentRun()));
    }

    /**
     * Sync a single Notion page, bypassing the scheduler.
     */
    @PostMapping("/sync/records/{recordId}")
    public Mono<UpsertResponse> syncRecord(@PathVariable String recordId) {
        return clientSyncService.upsertOne(recordId)
                .map(result -> UpsertResponse.builder()
                        .action(result.getAction().name())
                        .matchedBy(result.getMatchedBy() != null ? result.getMatchedBy().name() : null)
                        .client(result.getClient())
                        .build());
    }

    @GetMapping("/clients/{id}")
    public Mono<Client> getClient(@PathVariable UUID id) {
        return clientRepository.findById(id)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Client", id.toString())));
    }
}
