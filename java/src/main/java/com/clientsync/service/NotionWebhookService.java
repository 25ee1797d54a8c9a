package com.clientsync.service;

import com.clientsync.config.ClientSyncProperties;
import com.clientsync.exception.InvalidWebhookPayloadException;
import com.clientsync.exception.SyncErrorKind;
import com.clientsync.model.source.SourceRecord;
import com.clientsync.model.sync.DeleteResult;
import com.clientsync.model.sync.UpsertResult;
import com.clientsync.model.webhook.WebhookEvent;
import com.clientsync.model.webhook.WebhookEventType;
import com.clientsync.model.webhook.WebhookOutcome;
import com.clientsync.model.webhook.WebhookResult;
import com.clientsync.source.SourceClient;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Optional;

/**
 * Handles Notion webhook deliveries after signature checks.
 *
 * Failures are reported as {@link WebhookResult}s so the endpoint can answer 200 and keep
 * the subscription alive. Only internal faults surface as errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotionWebhookService {

    private final ClientSyncService clientSyncService;
    private final SourceClient sourceClient;
    private final ClientSyncProperties properties;
    private final ObjectMapper objectMapper;

    public Mono<WebhookResult> handle(String body) {
        JsonNode payload;
        try {
            payload = parse(body);
        } catch (InvalidWebhookPayloadException e) {
            log.warn("Invalid webhook payload: {}", e.getMessage());
            return Mono.just(WebhookResult.of(WebhookOutcome.INVALID, e.getMessage()));
        }

        WebhookResult handshake = handshake(payload);
        if (handshake != null) {
            return Mono.just(handshake);
        }

        WebhookEvent event;
        try {
            event = classify(payload);
        } catch (InvalidWebhookPayloadException e) {
            log.warn("Invalid webhook payload: {}", e.getMessage());
            return Mono.just(WebhookResult.of(WebhookOutcome.INVALID, e.getMessage()));
        }

        if (event.getType() == WebhookEventType.UNKNOWN) {
            log.info("Ignoring unsupported webhook event type '{}'", event.getRawType());
            return Mono.just(WebhookResult.of(WebhookOutcome.IGNORED,
                    "Event type '" + event.getRawType() + "' is not handled"));
        }

        log.info("Received {} for Notion page {} (collection {})",
                event.getRawType(), event.getRecordId(), event.getCollectionId());

        return dispatch(event)
                .onErrorResume(error -> {
                    SyncErrorKind kind = SyncErrorKind.classify(error);
                    switch (kind) {
                        case NOT_FOUND:
                            log.info("Notion page {} no longer exists, ignoring {}",
                                    event.getRecordId(), event.getRawType());
                            return Mono.just(WebhookResult.of(WebhookOutcome.IGNORED,
                                    "Page " + event.getRecordId() + " no longer exists"));
                        case TRANSIENT:
                            log.warn("Webhook for page {} failed, next sync will retry: {}",
                                    event.getRecordId(), error.getMessage());
                            return Mono.just(WebhookResult.of(WebhookOutcome.FAILED,
                                    SyncErrorKind.describe(event.getRecordId(), error)));
                        case INVALID:
                            log.warn("Webhook for page {} skipped: {}", event.getRecordId(), error.getMessage());
                            return Mono.just(WebhookResult.of(WebhookOutcome.INVALID,
                                    SyncErrorKind.describe(event.getRecordId(), error)));
                        default:
                            return Mono.error(error);
                    }
                });
    }

    /**
     * Extract type, page id and collection id. The field holding the page differs per event type.
     */
    WebhookEvent classify(JsonNode payload) {
        String rawType = payload.path("type").asText(null);
        WebhookEventType type = WebhookEventType.fromWireName(rawType);
        if (type == WebhookEventType.UNKNOWN) {
            return WebhookEvent.builder().type(type).rawType(rawType).build();
        }

        String recordId = textAt(payload, type.getRecordIdPath());
        if (recordId == null) {
            throw new InvalidWebhookPayloadException(
                    "No page id at " + type.getRecordIdPath() + " for event type '" + rawType + "'");
        }

        return WebhookEvent.builder()
                .type(type)
                .rawType(rawType)
                .recordId(recordId)
                .collectionId(textAt(payload, type.getCollectionIdPath()))
                .build();
    }

    private Mono<WebhookResult> dispatch(WebhookEvent event) {
        String configured = properties.getSource().getCollectionId();
        boolean filtering = configured != null && !configured.isBlank();

        if (filtering && event.getCollectionId() != null
                && !sameCollection(event.getCollectionId(), configured)) {
            return Mono.just(ignoredForCollection(event, event.getCollectionId()));
        }

        if (event.getType() == WebhookEventType.DELETED) {
            return clientSyncService.deleteBySourceRecord(event.getRecordId())
                    .map(result -> WebhookResult.of(WebhookOutcome.DELETED, deletedMessage(result)));
        }

        if (!filtering || event.getCollectionId() != null) {
            return clientSyncService.upsertOne(event.getRecordId()).map(this::upserted);
        }

        // collection not in the payload: look the page up once and reuse it
        return sourceClient.getRecord(event.getRecordId())
                .map(Optional::of)
                .onErrorResume(error -> SyncErrorKind.classify(error) == SyncErrorKind.TRANSIENT, error -> {
                    log.warn("Could not resolve collection of page {}, processing anyway: {}",
                            event.getRecordId(), error.getMessage());
                    return Mono.just(Optional.<SourceRecord>empty());
                })
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return clientSyncService.upsertOne(event.getRecordId()).map(this::upserted);
                    }
                    SourceRecord record = found.get();
                    if (record.getParentCollectionId() != null
                            && !sameCollection(record.getParentCollectionId(), configured)) {
                        return Mono.just(ignoredForCollection(event, record.getParentCollectionId()));
                    }
                    return clientSyncService.upsertRecord(record).map(this::upserted);
                });
    }

    private WebhookResult upserted(UpsertResult result) {
        if (result.isSkipped()) {
            return WebhookResult.of(WebhookOutcome.IGNORED,
                    "Page " + result.getSourceRecordId() + " is archived, ignored");
        }
        return WebhookResult.of(WebhookOutcome.UPSERTED, String.format("Client '%s' %s",
                result.getClient().getName(), result.isCreated() ? "created" : "updated"));
    }

    private static String deletedMessage(DeleteResult result) {
        if (result.getDeleted() == 0) {
            return "No client linked to page " + result.getSourceRecordId() + ", already deleted";
        }
        if (result.getDeleted() > 1) {
            return String.format("Deleted client '%s' and %d duplicate(s)",
                    result.getClientName(), result.getDeleted() - 1);
        }
        return "Deleted client '" + result.getClientName() + "'";
    }

    private WebhookResult ignoredForCollection(WebhookEvent event, String collectionId) {
        log.info("Ignoring {} for page {} from collection {}",
                event.getRawType(), event.getRecordId(), collectionId);
        return WebhookResult.of(WebhookOutcome.IGNORED,
                "Event from collection " + collectionId + " ignored");
    }

    private WebhookResult handshake(JsonNode payload) {
        String challenge = payload.hasNonNull("challenge")
                ? payload.get("challenge").asText()
                : payload.hasNonNull("verification_token") ? payload.get("verification_token").asText() : null;

        if (challenge != null) {
            log.info("Webhook verification challenge received");
            return WebhookResult.builder()
                    .outcome(WebhookOutcome.ACKNOWLEDGED)
                    .message("Webhook endpoint verified")
                    .challenge(challenge)
                    .build();
        }
        if (WebhookEventType.PING.getWireName().equals(payload.path("type").asText(null))) {
            return WebhookResult.of(WebhookOutcome.ACKNOWLEDGED, "Webhook endpoint verified");
        }
        return null;
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidWebhookPayloadException("Empty webhook body");
        }
        try {
            JsonNode payload = objectMapper.readTree(body);
            if (payload == null || !payload.isObject()) {
                throw new InvalidWebhookPayloadException("Webhook body is not a JSON object");
            }
            return payload;
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookPayloadException("Webhook body is not valid JSON", e);
        }
    }

    private static String textAt(JsonNode payload, JsonPointer path) {
        if (path == null) {
            return null;
        }
        JsonNode node = payload.at(path);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    static boolean sameCollection(String a, String b) {
        return normalizeId(a).equals(normalizeId(b));
    }

    private static String normalizeId(String id) {
        return id.replace("-", "").toLowerCase(Locale.ROOT);
    }
}
