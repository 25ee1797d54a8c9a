package com.clientsync.model.sync;

import com.clientsync.model.entity.Client;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of upserting one source record. {@code matchedBy} is null for created rows,
 * and {@code client} is null for skipped ones.
 */
@Value
@Builder
public class UpsertResult {
    String sourceRecordId;
    Client client;
    UpsertAction action;
    MatchStrategy matchedBy;

    public boolean isCreated() {
        return action == UpsertAction.CREATED;
    }

    public boolean isSkipped() {
        return action == UpsertAction.SKIPPED;
    }

    public static UpsertResult skipped(String sourceRecordId) {
        return UpsertResult.builder()
                .sourceRecordId(sourceRecordId)
                .action(UpsertAction.SKIPPED)
                .build();
    }
}
