package com.clientsync.model.sync;

import lombok.Builder;
import lombok.Value;

/**
 * The identifying fields of an incoming source record, as seen by the matcher.
 */
@Value
@Builder
public class MatchCandidate {
    String sourceRecordId;
    String name;
    String contactEmail;
}
