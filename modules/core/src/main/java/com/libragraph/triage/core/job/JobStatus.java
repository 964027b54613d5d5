package com.libragraph.triage.core.job;

import com.libragraph.triage.types.JobState;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a job as reported to callers.
 */
public record JobStatus(
        long jobId,
        String caseId,
        JobState state,
        long artifactsExtracted,
        long artifactsStored,
        String errorMessage,
        List<JobWarning> warnings,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static JobStatus of(JobRecord record, List<JobWarning> warnings) {
        return new JobStatus(record.id(), record.caseId(), record.state(), record.artifactsExtracted(),
                record.artifactsStored(), record.errorMessage(), List.copyOf(warnings), record.createdAt(),
                record.startedAt(), record.finishedAt());
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
