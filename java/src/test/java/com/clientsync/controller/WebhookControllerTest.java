package com.clientsync.controller;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.model.webhook.WebhookOutcome;
import com.clientsync.model.webhook.WebhookResult;
import com.clientsync.security.WebhookSignatureVerifier;
import com.clientsync.service.NotionWebhookService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for WebhookController.
 */
@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    private static final String BODY = "{\"type\":\"page.updated\",\"page\":{\"id\":\"p1\"}}";
    private static final String SECRET = "whsec_test";

    @Mock
    private NotionWebhookService webhookService;

    private ClientSyncProperties properties;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        properties = new ClientSyncProperties();
        WebhookController controller = new WebhookController(webhookService,
                new WebhookSignatureVerifier(properties), properties,
                Clock.fixed(Instant.parse("2024-03-04T15:00:00Z"), ZoneOffset.UTC));
        webTestClient = WebTestClient.bindToController(controller).build();
    }

    @Test
    void receive_UnsignedAcceptedWithoutSecret() {
        when(webhookService.handle(BODY)).thenReturn(Mono.just(
                WebhookResult.of(WebhookOutcome.UPSERTED, "Client 'Acme Corp' updated")));

        post(BODY, null, null)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("Client 'Acme Corp' updated")
                .jsonPath("$.challenge").doesNotExist();
    }

    @Test
    void receive_ValidSignatureAccepted() {
        properties.getWebhook().setSecret(SECRET);
        when(webhookService.handle(BODY)).thenReturn(Mono.just(
                WebhookResult.of(WebhookOutcome.DELETED, "Deleted client 'Acme Corp'")));

        String timestamp = "1709564400";
        post(BODY, "sha256=" + WebhookSignatureVerifier.sign(SECRET, timestamp, BODY), timestamp)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true);
    }

    @Test
    void receive_BadSignatureRejected() {
        properties.getWebhook().setSecret(SECRET);

        post(BODY, WebhookSignatureVerifier.sign("other-secret", "1709564400", BODY), "1709564400")
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("Invalid signature");

        verifyNoInteractions(webhookService);
    }

    @Test
    void receive_RejectedWhenSignatureRequiredButNoSecret() {
        properties.getWebhook().setRequireSignature(true);

        post(BODY, null, null)
                .expectStatus().isUnauthorized();

        verifyNoInteractions(webhookService);
    }

    @Test
    void receive_ChallengeEchoedAlone() {
        String body = "{\"challenge\":\"abc123\"}";
        when(webhookService.handle(body)).thenReturn(Mono.just(WebhookResult.builder()
                .outcome(WebhookOutcome.ACKNOWLEDGED)
                .message("Webhook endpoint verified")
                .challenge("abc123")
                .build()));

        post(body, null, null)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.challenge").isEqualTo("abc123")
                .jsonPath("$.success").doesNotExist();
    }

    @Test
    void receive_FailedProcessingStillAnswers200() {
        when(webhookService.handle(any())).thenReturn(Mono.just(
                WebhookResult.of(WebhookOutcome.FAILED, "[TRANSIENT] p1: timeout")));

        post(BODY, null, null)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("[TRANSIENT] p1: timeout");
    }

    @Test
    void receive_InternalErrorIs500() {
        when(webhookService.handle(any())).thenReturn(Mono.error(new IllegalStateException("db down")));

        post(BODY, null, null)
                .expectStatus().isEqualTo(500)
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("Internal server error: db down");
    }

    @Test
    void health_ReportsConfiguration() {
        properties.getWebhook().setSecret(SECRET);
        properties.getSource().setCollectionId("c1");

        webTestClient.get()
                .uri("/api/webhooks/notion/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.config.hasWebhookSecret").isEqualTo(true)
                .jsonPath("$.config.requireSignature").isEqualTo(false)
                .jsonPath("$.config.hasNotionApiKey").isEqualTo(false)
                .jsonPath("$.config.hasCollectionId").isEqualTo(true);
    }

    private WebTestClient.ResponseSpec post(String body, String signature, String timestamp) {
        WebTestClient.RequestBodySpec request = webTestClient.post()
                .uri("/api/webhooks/notion")
                .contentType(MediaType.APPLICATION_JSON);
        if (signature != null) {
            request = request.header(WebhookController.SIGNATURE_HEADER, signature);
        }
        if (timestamp != null) {
            request = request.header(WebhookController.TIMESTAMP_HEADER, timestamp);
        }
        return request.bodyValue(body.getBytes(StandardCharsets.UTF_8)).exchange();
    }
}
