package com.libragraph.triage.core.job;

import com.libragraph.triage.formats.error.TriageException;
import com.libragraph.triage.types.JobState;

/**
 * A job was requested for a case that already has one queued or running,
 * or whose previous job has not finished stopping.
 */
public class JobConflictException extends TriageException {

    private final String caseId;
    private final long activeJobId;
    private final JobState activeState;

    public JobConflictException(String caseId, long activeJobId, JobState activeState) {
        this("Extraction already " + activeState.label() + " for case " + caseId + " (job " + activeJobId + ")",
                caseId, activeJobId, activeState);
    }

    private JobConflictException(String message, String caseId, long activeJobId, JobState activeState) {
        super(message);
        this.caseId = caseId;
        this.activeJobId = activeJobId;
        this.activeState = activeState;
    }

    /**
     * The job is already recorded as terminal but its extractors have not
     * yet stopped writing.
     */
    public static JobConflictException stillStopping(String caseId, long jobId, JobState recorded) {
        return new JobConflictException("Extraction job " + jobId + " for case " + caseId
                + " is " + recorded.label() + " but still stopping", caseId, jobId, recorded);
    }

    public String caseId() {
        return caseId;
    }

    public long activeJobId() {
        return activeJobId;
    }

    public JobState activeState() {
        return activeState;
    }
}
