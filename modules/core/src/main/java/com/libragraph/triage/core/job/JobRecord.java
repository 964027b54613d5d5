package com.libragraph.triage.core.job;

import com.libragraph.triage.types.JobState;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record JobRecord(
        @ColumnName("id") long id,
        @ColumnName("case_id") String caseId,
        @ColumnName("state") JobState state,
        @ColumnName("artifacts_extracted") long artifactsExtracted,
        @ColumnName("artifacts_stored") long artifactsStored,
        @ColumnName("error_message") String errorMessage,
        @ColumnName("error_type") String errorType,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("started_at") Instant startedAt,
        @ColumnName("finished_at") Instant finishedAt
) {}
