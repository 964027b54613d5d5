package com.libragraph.triage.core.job;

import com.libragraph.triage.core.dao.JobDao;
import com.libragraph.triage.types.JobState;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Fails jobs that can no longer finish: those left active by a previous
 * process and running jobs past their budget.
 */
@ApplicationScoped
public class StaleJobRecovery {

    private static final Logger log = Logger.getLogger(StaleJobRecovery.class);

    @Inject
    Jdbi jdbi;

    @Inject
    JobController controller;

    public StaleJobRecovery() {
    }

    public StaleJobRecovery(Jdbi jdbi, JobController controller) {
        this.jdbi = jdbi;
        this.controller = controller;
    }

    @Scheduled(every = "30s", concurrentExecution = SKIP)
    public void sweep() {
        recoverOrphaned();
        recoverOverdue();
    }

    /** Active jobs created before this process started and not running here. */
    int recoverOrphaned() {
        Instant boot = controller.bootTime();
        List<JobRecord> active = jdbi.withExtension(JobDao.class,
                dao -> dao.findInStates(JobState.QUEUED, JobState.RUNNING));
        int recovered = 0;
        for (JobRecord job : active) {
            if (job.createdAt().isBefore(boot) && !controller.isTracked(job.id())) {
                if (controller.fail(job.id(), JobError.of(JobController.INTERRUPTED))) {
                    log.warnf("Job %d (case %s) was left %s by a previous run; marked failed",
                            job.id(), job.caseId(), job.state().label());
                    recovered++;
                }
            }
        }
        return recovered;
    }

    /** Running jobs whose wall-clock budget is spent. */
    int recoverOverdue() {
        long minutes = controller.timeoutMinutes();
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(minutes));
        List<JobRecord> running = jdbi.withExtension(JobDao.class, dao -> dao.findInStates(JobState.RUNNING));
        int recovered = 0;
        for (JobRecord job : running) {
            if (job.startedAt() != null && !job.startedAt().isAfter(cutoff)) {
                controller.signalStop(job.id());
                if (controller.fail(job.id(), JobError.of(JobController.timeoutMessage(minutes)))) {
                    log.warnf("Job %d (case %s) exceeded %d minutes; marked failed", job.id(), job.caseId(), minutes);
                    recovered++;
                }
            }
        }
        return recovered;
    }
}
