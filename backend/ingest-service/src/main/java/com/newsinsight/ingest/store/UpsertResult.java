package com.newsinsight.ingest.store;

public enum UpsertResult {
    /** New URL stored */
    INSERTED,
    /** Existing URL overwritten with the latest fields */
    UPDATED,
    /** New URL dropped as a near-duplicate of a recently stored title */
    SUPPRESSED
}
