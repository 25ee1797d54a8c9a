package com.clientsync.exception;

import com.clientsync.model.sync.SyncRun;
import lombok.Getter;

/**
 * Raised when a bulk pass is requested while another one is running.
 * Carries the empty run so callers can still report counters.
 */
@Getter
public class SyncAlreadyInProgressException extends RuntimeException {

    private final transient SyncRun syncRun;

    public SyncAlreadyInProgressException(SyncRun syncRun) {
        super("Sync already in progress");
        this.syncRun = syncRun;
    }
}
