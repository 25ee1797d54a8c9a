package com.clientsync.source;

import com.clientsync.model.source.SourceRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Read-only access to the external client database.
 *
 * Implementations signal {@link com.clientsync.exception.SourceRecordNotFoundException}
 * only when the source positively reports the record as missing, and
 * {@link com.clientsync.exception.SourceUnavailableException} for every other failure.
 */
public interface SourceClient {

    Mono<SourceRecord> getRecord(String recordId);

    /**
     * All pages of a collection in source order, optionally only those edited after {@code modifiedAfter}.
     */
    Flux<SourceRecord> queryCollection(String collectionId, Instant modifiedAfter);

    /**
     * Plain text of the record's body blocks.
     */
    Mono<String> getChildContent(String recordId);
}
