package com.clientsync.exception;

import lombok.Getter;

/**
 * The source answered "not found" for a record or collection.
 * This is the only error that may lead to a registry row being deleted.
 */
@Getter
public class SourceRecordNotFoundException extends RuntimeException {

    private final String recordId;

    public SourceRecordNotFoundException(String recordId) {
        super(String.format("Source record '%s' not found", recordId));
        this.recordId = recordId;
    }
}
