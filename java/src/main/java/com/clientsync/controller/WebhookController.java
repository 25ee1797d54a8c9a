package com.clientsync.controller;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.model.dto.WebhookResponse;
import com.clientsync.model.webhook.WebhookResult;
import com.clientsync.security.WebhookSignatureVerifier;
import com.clientsync.service.NotionWebhookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Notion webhook endpoint.
 *
 * Everything except a bad signature and internal faults is answered with 200,
 * since Notion disables subscriptions that keep failing.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Notion-Signature";
    static final String TIMESTAMP_HEADER = "X-Notion-Timestamp";

    private final NotionWebhookService webhookService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ClientSyncProperties properties;
    private final Clock clock;

    @Value("${clientsync.notion.api-key:}")
    private String notionApiKey;

    @PostMapping("/notion")
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @RequestBody(required = false) String body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = TIMESTAMP_HEADER, required = false) String timestamp) {

        if (signatureVerifier.verify(timestamp, body, signature) == WebhookSignatureVerifier.Verdict.REJECTED) {
            return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(response(false, "Invalid signature")));
        }

        return webhookService.handle(body)
                .map(this::toResponse)
                .onErrorResume(error -> {
                    log.error("Error processing webhook", error);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(response(false, "Internal server error: " + error.getMessage())));
                });
    }

    @GetMapping("/notion/health")
    public Mono<Map<String, Object>> health() {
        return Mono.just(Map.of(
                "success", true,
                "message", "Notion webhook endpoint is healthy",
                "timestamp", clock.instant().toString(),
                "config", Map.of(
                        "hasWebhookSecret", !isBlank(properties.getWebhook().getSecret()),
                        "requireSignature", properties.getWebhook().isRequireSignature(),
                        "hasNotionApiKey", !isBlank(notionApiKey),
                        "hasCollectionId", !isBlank(properties.getSource().getCollectionId()))));
    }

    private ResponseEntity<WebhookResponse> toResponse(WebhookResult result) {
        if (result.getChallenge() != null) {
            return ResponseEntity.ok(WebhookResponse.builder().challenge(result.getChallenge()).build());
        }
        return ResponseEntity.ok(response(result.isSuccess(), result.getMessage()));
    }

    private WebhookResponse response(boolean success, String message) {
        return WebhookResponse.builder()
                .success(success)
                .message(message)
                .timestamp(clock.instant())
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
