package com.clientsync.model.webhook;

import com.fasterxml.jackson.core.JsonPointer;

/**
 * Notion webhook event types.
 *
 * Created/updated events carry the page under {@code page}; content, property and
 * delete events carry it under {@code entity} with the parent in {@code data.parent}.
 */
public enum WebhookEventType {
    CREATED("page.created", "/page/id", "/page/parent/database_id"),
    UPDATED("page.updated", "/page/id", "/page/parent/database_id"),
    CONTENT_UPDATED("page.content_updated", "/entity/id", "/data/parent/id"),
    PROPERTIES_UPDATED("page.properties_updated", "/entity/id", "/data/parent/id"),
    DELETED("page.deleted", "/entity/id", "/data/parent/id"),
    PING("ping", null, null),
    UNKNOWN(null, null, null);

    private final String wireName;
    private final JsonPointer recordIdPath;
    private final JsonPointer collectionIdPath;

    WebhookEventType(String wireName, String recordIdPath, String collectionIdPath) {
        this.wireName = wireName;
        this.recordIdPath = recordIdPath == null ? null : JsonPointer.compile(recordIdPath);
        this.collectionIdPath = collectionIdPath == null ? null : JsonPointer.compile(collectionIdPath);
    }

    public String getWireName() {
        return wireName;
    }

    public JsonPointer getRecordIdPath() {
        return recordIdPath;
    }

    public JsonPointer getCollectionIdPath() {
        return collectionIdPath;
    }

    public static WebhookEventType fromWireName(String type) {
        if (type != null) {
            for (WebhookEventType candidate : values()) {
                if (type.equals(candidate.wireName)) {
                    return candidate;
                }
            }
        }
        return UNKNOWN;
    }
}
