package com.clientsync.controller;

import com.clientsync.service.ClientSyncService;
import com.clientsync.service.SyncStatsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.when;

/**
 * Tests for HealthController.
 */
@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private SyncStatsService syncStatsService;

    @Mock
    private ClientSyncService clientSyncService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new HealthController(syncStatsService, clientSyncService))
                .build();
    }

    @Test
    void root_ReturnsServiceInfo() {
        webTestClient.get()
                .uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.service").isEqualTo("ClientSync")
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_ReturnsHealthStatus() {
        when(syncStatsService.isHealthy()).thenReturn(true);
        when(clientSyncService.isSyncInProgress()).thenReturn(false);

        webTestClient.get()
                .uri("/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.syncInProgress").isEqualTo(false)
                .jsonPath("$.version").isEqualTo("1.0.0");
    }

    @Test
    void health_DegradedWhenSyncIsStale() {
        when(syncStatsService.isHealthy()).thenReturn(false);
        when(clientSyncService.isSyncInProgress()).thenReturn(true);

        webTestClient.get()
                .uri("/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.syncInProgress").isEqualTo(true);
    }
}
