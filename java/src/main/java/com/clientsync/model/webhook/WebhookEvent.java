package com.clientsync.model.webhook;

import lombok.Builder;
import lombok.Value;

/**
 * A classified webhook delivery. {@code collectionId} is null when the payload did not carry it.
 */
@Value
@Builder
public class WebhookEvent {
    WebhookEventType type;
    String rawType;
    String recordId;
    String collectionId;
}
