package com.clientsync.model.webhook;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookEventTypeTest {

    @Test
    void fromWireName_KnownTypes() {
        assertThat(WebhookEventType.fromWireName("page.created")).isEqualTo(WebhookEventType.CREATED);
        assertThat(WebhookEventType.fromWireName("page.deleted")).isEqualTo(WebhookEventType.DELETED);
        assertThat(WebhookEventType.fromWireName("ping")).isEqualTo(WebhookEventType.PING);
    }

    @Test
    void fromWireName_EverythingElseIsUnknown() {
        assertThat(WebhookEventType.fromWireName(null)).isEqualTo(WebhookEventType.UNKNOWN);
        assertThat(WebhookEventType.fromWireName("page.moved")).isEqualTo(WebhookEventType.UNKNOWN);
        assertThat(WebhookEventType.fromWireName("PAGE.CREATED")).isEqualTo(WebhookEventType.UNKNOWN);
        assertThat(WebhookEventType.values())
                .extracting(WebhookEventType::name)
                .containsExactly("CREATED", "UPDATED", "CONTENT_UPDATED", "PROPERTIES_UPDATED", "DELETED",
                        "PING", "UNKNOWN");
    }
}
