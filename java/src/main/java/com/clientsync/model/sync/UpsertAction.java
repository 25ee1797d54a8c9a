package com.clientsync.model.sync;

public enum UpsertAction {
    CREATED,
    UPDATED,
    /** The page is archived in Notion; the registry was not touched. */
    SKIPPED
}
