package com.libragraph.triage.core.job;

import com.libragraph.triage.core.TestDatabase;
import com.libragraph.triage.core.cases.CaseService;
import com.libragraph.triage.core.dao.JobDao;
import com.libragraph.triage.core.extract.ExtractorRegistry;
import com.libragraph.triage.core.store.ArtifactStore;
import com.libragraph.triage.formats.filesystem.FilesystemWalker;
import com.libragraph.triage.formats.image.ImageIngestor;
import com.libragraph.triage.types.JobState;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class StaleJobRecoveryTest {

    private Jdbi jdbi;
    private ExecutorService executor;
    private JobController controller;
    private StaleJobRecovery recovery;

    @BeforeEach
    void setUp() {
        jdbi = TestDatabase.create();
        executor = Executors.newSingleThreadExecutor();
        controller = new JobController(jdbi, new CaseService(jdbi), new ArtifactStore(jdbi, TestDatabase.codec()),
                ImageIngestor.withDefaults(), new FilesystemWalker(), ExtractorRegistry.of(List.of()),
                executor, executor, 1, false);
        recovery = new StaleJobRecovery(jdbi, controller);
        TestDatabase.insertCase(jdbi, "c1");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private long job(Instant createdAt, Instant startedAt) {
        return jdbi.withExtension(JobDao.class, dao -> {
            long id = dao.insert("c1", JobState.QUEUED, createdAt);
            if (startedAt != null) dao.markRunning(id, startedAt, JobState.QUEUED, JobState.RUNNING);
            return id;
        });
    }

    @Test
    void jobsLeftActiveByAPreviousProcessShouldBeFailed() {
        Instant earlier = controller.bootTime().minus(Duration.ofHours(1));
        long running = job(earlier, earlier.plusSeconds(1));
        long queued = job(earlier, null);

        assertThat(recovery.recoverOrphaned()).isEqualTo(2);

        for (long id : List.of(running, queued)) {
            JobStatus status = controller.job(id).orElseThrow();
            assertThat(status.state()).isEqualTo(JobState.FAILED);
            assertThat(status.errorMessage()).isEqualTo(JobController.INTERRUPTED);
        }
        assertThat(recovery.recoverOrphaned()).isZero();
    }

    @Test
    void jobsCreatedByThisProcessShouldNotCountAsOrphaned() {
        long fresh = job(controller.bootTime().plusMillis(1), null);

        assertThat(recovery.recoverOrphaned()).isZero();
        assertThat(controller.job(fresh).orElseThrow().state()).isEqualTo(JobState.QUEUED);
    }

    @Test
    void runningJobsPastTheirBudgetShouldTimeOut() {
        Instant now = Instant.now();
        long overdue = job(now, now.minus(Duration.ofMinutes(2)));
        long recent = job(now, now);

        assertThat(recovery.recoverOverdue()).isEqualTo(1);

        JobStatus status = controller.job(overdue).orElseThrow();
        assertThat(status.state()).isEqualTo(JobState.FAILED);
        assertThat(status.errorMessage()).isEqualTo("Extraction timed out after 1 minutes");
        assertThat(controller.job(recent).orElseThrow().state()).isEqualTo(JobState.RUNNING);
    }
}
