package com.libragraph.triage.core.store;

import java.time.Instant;

/**
 * Optional narrowing of an artifact query. Null fields do not filter.
 *
 * @param from  inclusive lower bound on the timestamp
 * @param to    exclusive upper bound on the timestamp
 * @param text  case-insensitive substring of the natural key or description
 * @param limit maximum rows, 0 for no limit
 */
public record ArtifactFilter(Instant from, Instant to, String text, int limit, int offset) {

    public static final ArtifactFilter ALL = new ArtifactFilter(null, null, null, 0, 0);

    public ArtifactFilter {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + from + " .. " + to);
        }
        if (text != null && text.isBlank()) text = null;
    }

    public ArtifactFilter between(Instant newFrom, Instant newTo) {
        return new ArtifactFilter(newFrom, newTo, text, limit, offset);
    }

    public ArtifactFilter matching(String newText) {
        return new ArtifactFilter(from, to, newText, limit, offset);
    }

    public ArtifactFilter page(int newLimit, int newOffset) {
        return new ArtifactFilter(from, to, text, newLimit, newOffset);
    }
}
