package com.clientsync.model.sync;

import java.util.Locale;

/**
 * Kind of bulk sync pass.
 */
public enum SyncKind {
    FULL,
    INCREMENTAL;

    /**
     * Parse the value accepted by the admin trigger. "comprehensive" is the older name for a full pass.
     */
    public static SyncKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return INCREMENTAL;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "full":
            case "comprehensive":
                return FULL;
            case "incremental":
                return INCREMENTAL;
            default:
                throw new IllegalArgumentException(
                        "Invalid sync kind '" + value + "'. Must be \"full\" or \"incremental\"");
        }
    }
}
