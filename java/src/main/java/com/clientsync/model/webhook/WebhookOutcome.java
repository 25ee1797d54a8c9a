package com.clientsync.model.webhook;

public enum WebhookOutcome {
    ACKNOWLEDGED,
    IGNORED,
    UPSERTED,
    DELETED,
    INVALID,
    FAILED
}
