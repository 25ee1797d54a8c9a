package com.clientsync.model.sync;

/**
 * Record-linkage strategies, declared in the order the matcher tries them.
 */
public enum MatchStrategy {
    SOURCE_RECORD_ID,
    EXACT_NAME,
    CONTACT_EMAIL,
    FUZZY_NAME,
    SLUG,
    BASE_NAME
}
