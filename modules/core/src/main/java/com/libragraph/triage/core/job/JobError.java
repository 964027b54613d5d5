package com.libragraph.triage.core.job;

import com.libragraph.triage.formats.error.TriageException;

/**
 * Why a job failed, as persisted on the job row.
 *
 * @param fatal whether the failure ended the job, as opposed to costing one extractor
 */
public record JobError(
        String message,
        String exceptionType,
        boolean fatal
) {
    public static JobError of(String message) {
        return new JobError(message, null, true);
    }

    public static JobError from(Throwable t, boolean fatal) {
        String message = t.getMessage();
        if (message == null || message.isBlank()) {
            message = t.getClass().getSimpleName();
        } else if (!(t instanceof TriageException)) {
            // triage errors already read as user-facing text
            message = t.getClass().getSimpleName() + ": " + message;
        }
        return new JobError(message, t.getClass().getName(), fatal);
    }
}
