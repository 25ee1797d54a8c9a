package com.clientsync.exception;

import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.util.concurrent.TimeoutException;

/**
 * Error taxonomy used for per-record error strings and HTTP mapping.
 */
public enum SyncErrorKind {
    NOT_FOUND,
    TRANSIENT,
    INVALID,
    ALREADY_IN_PROGRESS,
    INTERNAL;

    public static SyncErrorKind classify(Throwable error) {
        if (error instanceof SourceRecordNotFoundException) {
            return NOT_FOUND;
        }
        if (error instanceof SourceUnavailableException
                || error instanceof TimeoutException
                || error instanceof WebClientRequestException) {
            return TRANSIENT;
        }
        if (error instanceof InvalidSourceRecordException
                || error instanceof InvalidWebhookPayloadException
                || error instanceof IllegalArgumentException) {
            return INVALID;
        }
        if (error instanceof SyncAlreadyInProgressException) {
            return ALREADY_IN_PROGRESS;
        }
        return INTERNAL;
    }

    /**
     * Format an error for a run's error list, e.g. {@code [TRANSIENT] p1: timeout}.
     */
    public static String describe(String recordId, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return String.format("[%s] %s: %s", classify(error), recordId, message);
    }
}
