package com.clientsync.model.sync;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of the webhook delete path. {@code deleted} is 0 when nothing was linked to the record.
 */
@Value
@Builder
public class DeleteResult {
    String sourceRecordId;
    int deleted;
    String clientName;
}
