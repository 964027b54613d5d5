package com.libragraph.triage.core.store;

/**
 * Outcome of {@link ArtifactStore#upsert}.
 */
public enum UpsertResult {
    /** No artifact with this identity existed; a row was inserted. */
    STORED,
    /** The identity existed and the payload's merge rule widened the stored row. */
    MERGED,
    /** The identity existed and nothing changed. */
    DUPLICATE
}
