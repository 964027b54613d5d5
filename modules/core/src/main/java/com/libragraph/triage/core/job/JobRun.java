package com.libragraph.triage.core.job;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory side of a job this process is executing.
 */
final class JobRun {

    final long jobId;
    final String caseId;
    final AtomicLong extracted = new AtomicLong();
    final AtomicLong stored = new AtomicLong();
    volatile Instant startedAt;
    private volatile boolean cancelled;

    JobRun(long jobId, String caseId) {
        this.jobId = jobId;
        this.caseId = caseId;
    }

    /**
     * Raises the stop flag. Once this returns, no store write of the run is in
     * progress and none starts afterwards.
     */
    void cancel() {
        synchronized (this) {
            cancelled = true;
        }
    }

    boolean isCancelled() {
        return cancelled;
    }

    /**
     * Runs one store write unless the run was stopped.
     *
     * @return false when the stop flag was already up
     */
    synchronized boolean write(Runnable storeWrite) {
        if (cancelled) return false;
        storeWrite.run();
        return true;
    }
}
