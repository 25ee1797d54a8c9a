package com.clientsync.exception;

/**
 * Transient failure talking to the source: network, timeout, rate limit, auth or 5xx.
 * Never treated as a deletion signal; the next scheduled pass picks the record up again.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
