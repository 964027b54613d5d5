package com.libragraph.triage.core.dao;

import com.libragraph.triage.types.ArtifactType;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record ArtifactRow(
        @ColumnName("id") long id,
        @ColumnName("case_id") String caseId,
        @ColumnName("artifact_type") ArtifactType type,
        @ColumnName("natural_key") String naturalKey,
        @ColumnName("key_hash") String keyHash,
        @ColumnName("event_time") Instant eventTime,
        @ColumnName("source_path") String sourcePath,
        @ColumnName("description") String description,
        @ColumnName("payload") String payload,
        @ColumnName("job_id") Long jobId,
        @ColumnName("extracted_at") Instant extractedAt,
        @ColumnName("updated_at") Instant updatedAt
) {}
