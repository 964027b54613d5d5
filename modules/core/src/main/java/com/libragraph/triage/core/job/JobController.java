package com.libragraph.triage.core.job;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.cases.CaseNotFoundException;
import com.libragraph.triage.core.cases.CaseRecord;
import com.libragraph.triage.core.cases.CaseService;
import com.libragraph.triage.core.dao.CaseDao;
import com.libragraph.triage.core.dao.JobDao;
import com.libragraph.triage.core.extract.ArtifactExtractor;
import com.libragraph.triage.core.extract.ExtractionContext;
import com.libragraph.triage.core.extract.ExtractorRegistry;
import com.libragraph.triage.core.store.ArtifactStore;
import com.libragraph.triage.core.store.UpsertResult;
import com.libragraph.triage.formats.error.TriageException;
import com.libragraph.triage.formats.filesystem.FilesystemWalker;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.formats.image.ImageHandle;
import com.libragraph.triage.formats.image.ImageIngestor;
import com.libragraph.triage.types.JobState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs extraction jobs: one image, every registered extractor, every artifact
 * into the store. At most one job per case is queued or running at a time.
 * <p>
 * Cancellation and the wall-clock budget are checked before every extractor
 * and before every artifact is stored. A case whose previous run is still
 * stopping accepts no new job until that run's threads have exited.
 */
@ApplicationScoped
public class JobController {

    private static final Logger log = Logger.getLogger(JobController.class);

    static final String CANCELLED = "Extraction cancelled";
    static final String INTERRUPTED = "Extraction interrupted by restart";
    static final String ALL_FAILED = "All extractors failed";
    static final String FILESYSTEM_SOURCE = "filesystem";

    private static final int PROGRESS_INTERVAL = 500;
    private static final long AWAIT_POLL_MS = 50;

    @Inject
    Jdbi jdbi;

    @Inject
    CaseService cases;

    @Inject
    ArtifactStore store;

    @Inject
    ImageIngestor ingestor;

    @Inject
    FilesystemWalker walker;

    @Inject
    ExtractorRegistry extractors;

    @Inject
    @Named("extractionExecutor")
    ExecutorService executor;

    @Inject
    @Named("extractorExecutor")
    ExecutorService extractorExecutor;

    @ConfigProperty(name = "triage.jobs.timeout-minutes", defaultValue = "120")
    long timeoutMinutes;

    @ConfigProperty(name = "triage.jobs.parallel-extractors", defaultValue = "true")
    boolean parallelExtractors;

    private final Instant bootTime = Instant.now();
    private final Map<Long, JobRun> runs = new ConcurrentHashMap<>();
    private final Map<String, Object> caseLocks = new ConcurrentHashMap<>();

    public JobController() {
    }

    public JobController(Jdbi jdbi, CaseService cases, ArtifactStore store, ImageIngestor ingestor,
                         FilesystemWalker walker, ExtractorRegistry extractors, ExecutorService executor,
                         ExecutorService extractorExecutor, long timeoutMinutes, boolean parallelExtractors) {
        this.jdbi = jdbi;
        this.cases = cases;
        this.store = store;
        this.ingestor = ingestor;
        this.walker = walker;
        this.extractors = extractors;
        this.executor = executor;
        this.extractorExecutor = extractorExecutor;
        this.timeoutMinutes = timeoutMinutes;
        this.parallelExtractors = parallelExtractors;
    }

    /**
     * Queues an extraction of the case's image.
     *
     * @return the new job id
     * @throws CaseNotFoundException if the case is not registered
     * @throws JobConflictException  if the case already has a queued or running job
     */
    public long submit(String caseId) {
        synchronized (caseLocks.computeIfAbsent(caseId, k -> new Object())) {
            long jobId = jdbi.inTransaction(handle -> {
                if (handle.attach(CaseDao.class).lock(caseId).isEmpty()) {
                    throw new CaseNotFoundException(caseId);
                }
                JobDao dao = handle.attach(JobDao.class);
                List<JobRecord> active = dao.findByCaseInStates(caseId, JobState.QUEUED, JobState.RUNNING);
                if (!active.isEmpty()) {
                    JobRecord current = active.get(0);
                    throw new JobConflictException(caseId, current.id(), current.state());
                }
                Optional<JobRun> stopping = liveRun(caseId);
                if (stopping.isPresent()) {
                    long stoppingId = stopping.get().jobId;
                    JobState recorded = dao.findById(stoppingId).map(JobRecord::state).orElse(JobState.FAILED);
                    throw JobConflictException.stillStopping(caseId, stoppingId, recorded);
                }
                return dao.insert(caseId, JobState.QUEUED, Instant.now());
            });

            JobRun run = new JobRun(jobId, caseId);
            runs.put(jobId, run);
            try {
                executor.execute(() -> execute(run));
            } catch (RejectedExecutionException e) {
                runs.remove(jobId);
                fail(jobId, JobError.from(e, true));
                throw e;
            }
            log.infof("Queued extraction job %d for case %s", jobId, caseId);
            return jobId;
        }
    }

    /**
     * Cancels the case's active job. A queued job fails at once; a running
     * one stores nothing further and fails once its extractors have stopped.
     *
     * @throws JobNotFoundException if the case has no active job
     */
    public JobStatus cancel(String caseId) {
        List<JobRecord> active = jdbi.withExtension(JobDao.class,
                dao -> dao.findByCaseInStates(caseId, JobState.QUEUED, JobState.RUNNING));
        if (active.isEmpty()) {
            throw JobNotFoundException.activeForCase(caseId);
        }
        for (JobRecord job : active) {
            JobRun run = runs.get(job.id());
            if (run != null) run.cancel();
            if (job.state() == JobState.QUEUED || run == null) {
                // nothing in this process will observe the flag
                fail(job.id(), JobError.of(CANCELLED));
            }
            log.infof("Cancellation requested for job %d (case %s, %s)", job.id(), caseId, job.state().label());
        }
        return job(active.get(active.size() - 1).id()).orElseThrow();
    }

    /**
     * Latest job of the case.
     *
     * @throws JobNotFoundException if the case never had a job
     */
    public JobStatus status(String caseId) {
        return jdbi.withExtension(JobDao.class, dao -> dao.findLatest(caseId)
                .map(r -> JobStatus.of(r, dao.warnings(r.id()))))
                .orElseThrow(() -> JobNotFoundException.forCase(caseId));
    }

    public Optional<JobStatus> job(long jobId) {
        return jdbi.withExtension(JobDao.class, dao -> dao.findById(jobId)
                .map(r -> JobStatus.of(r, dao.warnings(r.id()))));
    }

    public List<JobStatus> history(String caseId) {
        return jdbi.withExtension(JobDao.class, dao -> dao.findByCase(caseId).stream()
                .map(r -> JobStatus.of(r, dao.warnings(r.id())))
                .collect(Collectors.toList()));
    }

    public List<JobWarning> warnings(long jobId) {
        return jdbi.withExtension(JobDao.class, dao -> {
            if (dao.findById(jobId).isEmpty()) throw JobNotFoundException.forJob(jobId);
            return dao.warnings(jobId);
        });
    }

    /** Queued and running jobs of every case, oldest first. */
    public List<JobStatus> activeJobs() {
        return jdbi.withExtension(JobDao.class, dao -> dao.findInStates(JobState.QUEUED, JobState.RUNNING).stream()
                .map(r -> JobStatus.of(r, List.of()))
                .collect(Collectors.toList()));
    }

    /** Jobs this process is still executing, including any already recorded as failed but not yet stopped. */
    public List<Long> liveJobIds() {
        return runs.keySet().stream().sorted().collect(Collectors.toList());
    }

    /** Whether the case has a queued or running job. */
    public boolean isActive(String caseId) {
        return jdbi.withExtension(JobDao.class,
                dao -> dao.countInStates(caseId, JobState.QUEUED, JobState.RUNNING)) > 0;
    }

    /**
     * Waits until the job reaches a terminal state or the timeout passes, and
     * returns its last observed status.
     */
    public JobStatus awaitTerminal(long jobId, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        JobStatus status = job(jobId).orElseThrow(() -> JobNotFoundException.forJob(jobId));
        while (!status.isTerminal() && Instant.now().isBefore(deadline)) {
            try {
                Thread.sleep(AWAIT_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return status;
            }
            status = job(jobId).orElseThrow(() -> JobNotFoundException.forJob(jobId));
        }
        return status;
    }

    public long timeoutMinutes() {
        return timeoutMinutes;
    }

    Instant bootTime() {
        return bootTime;
    }

    /** Whether this process is executing the job. */
    boolean isTracked(long jobId) {
        return runs.containsKey(jobId);
    }

    /** Whether a run of the case is still executing here, whatever its recorded state. */
    boolean isLive(String caseId) {
        return liveRun(caseId).isPresent();
    }

    private Optional<JobRun> liveRun(String caseId) {
        return runs.values().stream().filter(r -> r.caseId.equals(caseId)).findFirst();
    }

    /** Stops a tracked run's store writes; returns once no write is in flight. */
    void signalStop(long jobId) {
        JobRun run = runs.get(jobId);
        if (run != null) run.cancel();
    }

    static String timeoutMessage(long minutes) {
        return "Extraction timed out after " + minutes + " minutes";
    }

    boolean fail(long jobId, JobError error) {
        int updated = jdbi.withExtension(JobDao.class, dao -> dao.fail(jobId, error.message(), error.exceptionType(),
                Instant.now(), JobState.FAILED, JobState.QUEUED, JobState.RUNNING));
        if (updated > 0) {
            log.errorf("Extraction job %d failed: %s", jobId, error.message());
        }
        return updated > 0;
    }

    // Execution

    /**
     * Runs the job and records its outcome. The run is released before the
     * outcome is written, once none of its threads can store anything.
     */
    void execute(JobRun run) {
        long jobId = run.jobId;
        JobError error = null;
        boolean finished = false;
        try {
            Instant started = Instant.now();
            int claimed = jdbi.withExtension(JobDao.class,
                    dao -> dao.markRunning(jobId, started, JobState.QUEUED, JobState.RUNNING));
            if (claimed == 0) {
                log.infof("Job %d is no longer queued; not running it", jobId);
                return;
            }
            run.startedAt = started;
            log.infof("Extraction job %d started for case %s", jobId, run.caseId);

            CaseRecord record = cases.require(run.caseId);
            ImageHandle image = ingestor.open(record.image());
            try {
                VolumeSet volumes = walker.mount(image);
                for (String warning : volumes.warnings()) {
                    warn(jobId, FILESYSTEM_SOURCE, warning);
                }
                runExtractors(run, volumes);
                checkpoint(run);
            } finally {
                close(image);
            }
            finished = true;
        } catch (JobAbortedException e) {
            error = JobError.of(e.getMessage());
        } catch (TriageException e) {
            error = JobError.from(e, true);
        } catch (RuntimeException e) {
            log.errorf(e, "Extraction job %d threw an unexpected exception", jobId);
            error = JobError.from(e, true);
        } finally {
            runs.remove(jobId);
        }
        if (finished) {
            complete(run);
        } else if (error != null) {
            fail(jobId, error);
        }
    }

    private void runExtractors(JobRun run, VolumeSet volumes) {
        List<ArtifactExtractor> all = extractors.all();
        List<String> failures = new ArrayList<>();
        if (parallelExtractors && all.size() > 1) {
            List<Future<Optional<String>>> futures = new ArrayList<>();
            for (ArtifactExtractor extractor : all) {
                futures.add(extractorExecutor.submit(() -> runExtractor(run, extractor, volumes)));
            }
            boolean finished = false;
            try {
                for (Future<Optional<String>> future : futures) {
                    await(future).ifPresent(failures::add);
                }
                finished = true;
            } finally {
                if (!finished) {
                    run.cancel();
                    drain(run, futures);
                }
            }
        } else {
            for (ArtifactExtractor extractor : all) {
                runExtractor(run, extractor, volumes).ifPresent(failures::add);
            }
        }
        if (!all.isEmpty() && failures.size() == all.size()) {
            throw new TriageException(ALL_FAILED + ": " + String.join("; ", failures));
        }
    }

    /** Waits for stopped sibling extractors so none outlives the run. */
    private static void drain(JobRun run, List<Future<Optional<String>>> futures) {
        for (Future<Optional<String>> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.debugf("Job %d: extractor ended with %s", run.jobId, e.getCause().toString());
            } catch (CancellationException e) {
                log.debugf("Job %d: extractor was cancelled before starting", run.jobId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warnf("Job %d: interrupted while waiting for extractors to stop", run.jobId);
                futures.forEach(f -> f.cancel(true));
                return;
            }
        }
    }

    private static Optional<String> await(Future<Optional<String>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JobAbortedException(CANCELLED);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
            throw new TriageException("Extractor failed", e.getCause());
        }
    }

    /**
     * Drains one extractor into the store.
     *
     * @return the failure message when the extractor threw
     */
    private Optional<String> runExtractor(JobRun run, ArtifactExtractor extractor, VolumeSet volumes) {
        checkpoint(run);
        String label = extractor.kind().label();
        ExtractionContext ctx = new ExtractionContext(run.caseId, extractor.kind(),
                (source, message) -> warn(run.jobId, source.label(), message));
        long before = run.extracted.get();
        try (Stream<Artifact> artifacts = extractor.extract(volumes, run.caseId, ctx)) {
            Iterator<Artifact> it = artifacts.iterator();
            while (it.hasNext()) {
                Artifact artifact = it.next();
                checkpoint(run);
                boolean written = run.write(() -> {
                    if (store.upsert(artifact, run.jobId) != UpsertResult.DUPLICATE) {
                        run.stored.incrementAndGet();
                    }
                });
                if (!written) throw new JobAbortedException(CANCELLED);
                long extracted = run.extracted.incrementAndGet();
                if (extracted % PROGRESS_INTERVAL == 0) progress(run);
            }
            log.infof("Job %d: %s extractor produced %d artifact(s)", run.jobId, label, run.extracted.get() - before);
            return Optional.empty();
        } catch (JobAbortedException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = label + " extractor failed: " + JobError.from(e, false).message();
            log.warnf(e, "Job %d: %s", run.jobId, message);
            warn(run.jobId, label, message);
            return Optional.of(message);
        } finally {
            progress(run);
        }
    }

    private void checkpoint(JobRun run) {
        if (run.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new JobAbortedException(CANCELLED);
        }
        Duration budget = Duration.ofMinutes(timeoutMinutes);
        if (run.startedAt != null && Duration.between(run.startedAt, Instant.now()).compareTo(budget) >= 0) {
            throw new JobAbortedException(timeoutMessage(timeoutMinutes));
        }
    }

    private void progress(JobRun run) {
        jdbi.useExtension(JobDao.class,
                dao -> dao.advance(run.jobId, run.extracted.get(), run.stored.get(), JobState.RUNNING));
    }

    private void complete(JobRun run) {
        progress(run);
        int updated = jdbi.withExtension(JobDao.class,
                dao -> dao.complete(run.jobId, Instant.now(), JobState.RUNNING, JobState.COMPLETED));
        if (updated == 0) {
            log.warnf("Job %d finished but was already terminal; keeping its recorded state", run.jobId);
            return;
        }
        log.infof("Extraction job %d completed for case %s: %d extracted, %d stored",
                run.jobId, run.caseId, run.extracted.get(), run.stored.get());
    }

    private void warn(long jobId, String source, String message) {
        jdbi.useExtension(JobDao.class, dao -> dao.insertWarning(jobId, source, message, Instant.now()));
    }

    private static void close(ImageHandle image) {
        try {
            image.close();
        } catch (IOException e) {
            log.warnf("Cannot close image %s: %s", image.path(), e.getMessage());
        }
    }

    /** Stops a run at a boundary; carries the failure message. */
    private static final class JobAbortedException extends RuntimeException {
        JobAbortedException(String message) {
            super(message, null, false, false);
        }
    }
}
