package com.libragraph.triage.core.job;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

/**
 * A non-fatal problem recorded against a job.
 *
 * @param source extractor kind, or {@code filesystem} for mount and traversal problems
 */
public record JobWarning(
        @ColumnName("source") String source,
        @ColumnName("message") String message,
        @ColumnName("created_at") Instant createdAt
) {}
