package com.clientsync.exception;

/**
 * A source record that cannot be turned into a client (no usable name, empty slug).
 */
public class InvalidSourceRecordException extends RuntimeException {

    public InvalidSourceRecordException(String recordId, String reason) {
        super(String.format("Source record '%s' skipped: %s", recordId, reason));
    }
}
