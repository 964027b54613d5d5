package com.libragraph.triage.core.job;

import com.libragraph.triage.formats.error.TriageException;

public class JobNotFoundException extends TriageException {

    public JobNotFoundException(String message) {
        super(message);
    }

    public static JobNotFoundException forCase(String caseId) {
        return new JobNotFoundException("No extraction job for case " + caseId);
    }

    public static JobNotFoundException activeForCase(String caseId) {
        return new JobNotFoundException("No active extraction job for case " + caseId);
    }

    public static JobNotFoundException forJob(long jobId) {
        return new JobNotFoundException("Extraction job not found: " + jobId);
    }
}
