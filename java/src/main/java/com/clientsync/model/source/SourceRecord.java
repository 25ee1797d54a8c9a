package com.clientsync.model.source;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A page from the Notion client database, read-only from the engine's side.
 */
@Value
@Builder
public class SourceRecord {

    String id;

    // insertion order follows the page JSON
    @Singular
    Map<String, SourceProperty> properties;

    Instant lastModifiedAt;

    String parentCollectionId;

    boolean archived;
}
