package com.clientsync.model.webhook;

import lombok.Builder;
import lombok.Value;

/**
 * What the webhook handler did with one delivery. {@code challenge} is set only
 * for verification handshakes and must be echoed back verbatim.
 */
@Value
@Builder
public class WebhookResult {
    WebhookOutcome outcome;
    String message;
    String challenge;

    public boolean isSuccess() {
        return outcome != WebhookOutcome.INVALID && outcome != WebhookOutcome.FAILED;
    }

    public static WebhookResult of(WebhookOutcome outcome, String message) {
        return WebhookResult.builder().outcome(outcome).message(message).build();
    }
}
