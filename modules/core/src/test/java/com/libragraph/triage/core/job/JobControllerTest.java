package com.libragraph.triage.core.job;

import com.libragraph.triage.core.TestDatabase;
import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.UsbDevice;
import com.libragraph.triage.core.cases.CaseNotFoundException;
import com.libragraph.triage.core.cases.CaseService;
import com.libragraph.triage.core.extract.ArtifactExtractor;
import com.libragraph.triage.core.extract.ExtractionContext;
import com.libragraph.triage.core.extract.ExtractorKind;
import com.libragraph.triage.core.extract.ExtractorRegistry;
import com.libragraph.triage.core.store.ArtifactStore;
import com.libragraph.triage.formats.filesystem.FilesystemWalker;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.formats.image.ImageIngestor;
import com.libragraph.triage.testing.NtfsImageBuilder;
import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.types.JobState;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class JobControllerTest {

    private static final String CASE = "case-7";
    private static final Duration WAIT = Duration.ofSeconds(20);
    private static final Instant SEEN = Instant.parse("2021-04-20T17:45:00Z");

    @TempDir
    Path tempDir;

    private Jdbi jdbi;
    private CaseService cases;
    private ArtifactStore store;
    private ExecutorService executor;
    private ExecutorService extractorExecutor;
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws Exception {
        jdbi = TestDatabase.create();
        cases = new CaseService(jdbi);
        store = new ArtifactStore(jdbi, TestDatabase.codec());
        executor = Executors.newSingleThreadExecutor();
        extractorExecutor = Executors.newCachedThreadPool();
        Path image = new NtfsImageBuilder()
                .file("/Users/alice/NTUSER.DAT", "hive")
                .writeVolume(tempDir.resolve("disk.dd"));
        cases.register(CASE, image);
    }

    @AfterEach
    void tearDown() throws Exception {
        release.countDown();
        executor.shutdownNow();
        extractorExecutor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private JobController controller(long timeoutMinutes, boolean parallel, ArtifactExtractor... extractors) {
        return new JobController(jdbi, cases, store, ImageIngestor.withDefaults(), new FilesystemWalker(),
                ExtractorRegistry.of(List.of(extractors)), executor, extractorExecutor, timeoutMinutes, parallel);
    }

    private JobController controller(ArtifactExtractor... extractors) {
        return controller(120, true, extractors);
    }

    private static ArtifactExtractor extractor(ExtractorKind kind,
                                               BiFunction<String, ExtractionContext, Stream<Artifact>> body) {
        return new ArtifactExtractor() {
            @Override
            public ExtractorKind kind() {
                return kind;
            }

            @Override
            public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
                return body.apply(caseId, ctx);
            }
        };
    }

    private static Artifact usb(String caseId, String serial) {
        return Artifact.of(caseId, ArtifactType.USB_DEVICE, serial, SEEN, "vol0:/Windows/System32/config/SYSTEM",
                "USB device " + serial, new UsbDevice(serial, "USBSTOR", "Kingston", null, null, null, SEEN, SEEN));
    }

    private ArtifactExtractor usbDevices(String... serials) {
        return extractor(ExtractorKind.REGISTRY, (caseId, ctx) -> Stream.of(serials).map(s -> usb(caseId, s)));
    }

    private ArtifactExtractor blocking(ExtractorKind kind) {
        return extractor(kind, (caseId, ctx) -> {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Stream.of(usb(caseId, "BLOCKED-" + kind.label()));
        });
    }

    private static ArtifactExtractor failing(ExtractorKind kind, String message) {
        return extractor(kind, (caseId, ctx) -> Stream.<Artifact>of(usb(caseId, "X")).map(a -> {
            throw new IllegalStateException(message);
        }));
    }

    @Test
    void jobShouldRunEveryExtractorAndCountStoredArtifacts() {
        JobController jobs = controller(usbDevices("A", "B", "A"),
                extractor(ExtractorKind.EVENT_LOG, (caseId, ctx) -> Stream.empty()));

        long jobId = jobs.submit(CASE);
        JobStatus status = jobs.awaitTerminal(jobId, WAIT);

        assertThat(status.state()).isEqualTo(JobState.COMPLETED);
        assertThat(status.artifactsExtracted()).isEqualTo(3);
        assertThat(status.artifactsStored()).isEqualTo(2);
        assertThat(status.startedAt()).isNotNull();
        assertThat(status.finishedAt()).isNotNull();
        assertThat(status.errorMessage()).isNull();
        assertThat(store.count(CASE)).isEqualTo(2);
        assertThat(jobs.isActive(CASE)).isFalse();
        assertThat(jobs.status(CASE)).isEqualTo(status);
    }

    @Test
    void reExtractionShouldNotDuplicateArtifacts() {
        JobController jobs = controller(usbDevices("A", "B"));

        JobStatus first = jobs.awaitTerminal(jobs.submit(CASE), WAIT);
        JobStatus second = jobs.awaitTerminal(jobs.submit(CASE), WAIT);

        assertThat(first.artifactsStored()).isEqualTo(2);
        assertThat(second.state()).isEqualTo(JobState.COMPLETED);
        assertThat(second.artifactsExtracted()).isEqualTo(2);
        assertThat(second.artifactsStored()).isZero();
        assertThat(store.count(CASE)).isEqualTo(2);
        assertThat(jobs.history(CASE)).extracting(JobStatus::jobId).containsExactly(first.jobId(), second.jobId());
    }

    @Test
    void secondSubmitWhileActiveShouldConflict() throws Exception {
        JobController jobs = controller(blocking(ExtractorKind.REGISTRY));
        long jobId = jobs.submit(CASE);
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> jobs.submit(CASE))
                .isInstanceOf(JobConflictException.class)
                .hasMessage("Extraction already running for case " + CASE + " (job " + jobId + ")");
        assertThat(jobs.isActive(CASE)).isTrue();
        assertThat(jobs.activeJobs()).singleElement().satisfies(job -> {
            assertThat(job.jobId()).isEqualTo(jobId);
            assertThat(job.caseId()).isEqualTo(CASE);
            assertThat(job.state()).isEqualTo(JobState.RUNNING);
        });

        release.countDown();
        assertThat(jobs.awaitTerminal(jobId, WAIT).state()).isEqualTo(JobState.COMPLETED);
        assertThat(jobs.history(CASE)).hasSize(1);
    }

    @Test
    void unknownCaseShouldBeRejected() {
        JobController jobs = controller(usbDevices("A"));

        assertThatThrownBy(() -> jobs.submit("nope")).isInstanceOf(CaseNotFoundException.class);
        assertThatThrownBy(() -> jobs.status("nope")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void cancellingARunningJobShouldStoreNothingFurther() throws Exception {
        JobController jobs = controller(120, false, blocking(ExtractorKind.REGISTRY), neverReached());
        long jobId = jobs.submit(CASE);
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

        JobStatus requested = jobs.cancel(CASE);
        assertThat(requested.state()).isEqualTo(JobState.RUNNING);
        release.countDown();

        JobStatus status = jobs.awaitTerminal(jobId, WAIT);
        assertThat(status.state()).isEqualTo(JobState.FAILED);
        assertThat(status.errorMessage()).isEqualTo(JobController.CANCELLED);
        assertThat(store.count(CASE)).isZero();
    }

    private static ArtifactExtractor neverReached() {
        return extractor(ExtractorKind.EVENT_LOG, (caseId, ctx) -> Stream.of(usb(caseId, "NEVER-REACHED")));
    }

    @Test
    void cancellingAQueuedJobShouldFailItImmediately() throws Exception {
        CountDownLatch busy = new CountDownLatch(1);
        executor.execute(() -> {
            try {
                busy.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        JobController jobs = controller(usbDevices("A"));
        long jobId = jobs.submit(CASE);

        JobStatus cancelled = jobs.cancel(CASE);
        busy.countDown();

        assertThat(cancelled.state()).isEqualTo(JobState.FAILED);
        assertThat(cancelled.errorMessage()).isEqualTo(JobController.CANCELLED);
        executor.submit(() -> { }).get(10, TimeUnit.SECONDS);
        JobStatus after = jobs.job(jobId).orElseThrow();
        assertThat(after.state()).isEqualTo(JobState.FAILED);
        assertThat(after.startedAt()).isNull();
        assertThat(store.count(CASE)).isZero();
    }

    @Test
    void cancelWithoutActiveJobShouldReportNotFound() {
        JobController jobs = controller(usbDevices("A"));
        jobs.awaitTerminal(jobs.submit(CASE), WAIT);

        assertThatThrownBy(() -> jobs.cancel(CASE)).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void exhaustedBudgetShouldFailTheJob() {
        JobController jobs = controller(0, true, usbDevices("A"));

        JobStatus status = jobs.awaitTerminal(jobs.submit(CASE), WAIT);

        assertThat(status.state()).isEqualTo(JobState.FAILED);
        assertThat(status.errorMessage()).isEqualTo("Extraction timed out after 0 minutes");
        assertThat(store.count(CASE)).isZero();
    }

    /** Stores A, then stalls before producing B until released. */
    private ArtifactExtractor stallingAfterFirst() {
        return extractor(ExtractorKind.REGISTRY, (caseId, ctx) -> Stream.of("A", "B", "C").map(serial -> {
            if (serial.equals("B")) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return usb(caseId, serial);
        }));
    }

    @Test
    void timedOutJobShouldStopWritingAndHoldTheCaseUntilItExits() throws Exception {
        JobController jobs = controller(1, true, stallingAfterFirst(),
                extractor(ExtractorKind.EVENT_LOG, (caseId, ctx) -> Stream.empty()));
        long jobId = jobs.submit(CASE);
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        jdbi.useHandle(h -> h.execute("UPDATE extraction_job SET started_at = ? WHERE id = ?",
                Instant.now().minus(Duration.ofMinutes(5)), jobId));

        assertThat(new StaleJobRecovery(jdbi, jobs).recoverOverdue()).isEqualTo(1);

        assertThat(jobs.job(jobId).orElseThrow().state()).isEqualTo(JobState.FAILED);
        assertThat(jobs.isActive(CASE)).isFalse();
        assertThat(jobs.activeJobs()).isEmpty();
        assertThat(jobs.liveJobIds()).containsExactly(jobId);
        assertThatThrownBy(() -> jobs.submit(CASE))
                .isInstanceOf(JobConflictException.class)
                .hasMessage("Extraction job " + jobId + " for case " + CASE + " is failed but still stopping");

        release.countDown();
        Instant deadline = Instant.now().plus(WAIT);
        while (jobs.isLive(CASE) && Instant.now().isBefore(deadline)) {
            Thread.sleep(20);
        }
        assertThat(jobs.isLive(CASE)).isFalse();
        assertThat(store.count(CASE)).isEqualTo(1);
        JobStatus timedOut = jobs.job(jobId).orElseThrow();
        assertThat(timedOut.state()).isEqualTo(JobState.FAILED);
        assertThat(timedOut.errorMessage()).isEqualTo("Extraction timed out after 1 minutes");

        JobStatus rerun = jobs.awaitTerminal(jobs.submit(CASE), WAIT);
        assertThat(rerun.state()).isEqualTo(JobState.COMPLETED);
        assertThat(store.count(CASE)).isEqualTo(3);
    }

    @Test
    void unreadableImageShouldFailWithTheIngestMessage() {
        cases.register("ghost", tempDir.resolve("missing.E01"));
        JobController jobs = controller(usbDevices("A"));

        JobStatus status = jobs.awaitTerminal(jobs.submit("ghost"), WAIT);

        assertThat(status.state()).isEqualTo(JobState.FAILED);
        assertThat(status.errorMessage()).startsWith("Image file not found: ").endsWith("missing.E01");
    }

    @Test
    void failingExtractorShouldOnlyCostItsOwnArtifacts() {
        JobController jobs = controller(120, false, usbDevices("A"),
                failing(ExtractorKind.BROWSER, "history database exploded"));

        JobStatus status = jobs.awaitTerminal(jobs.submit(CASE), WAIT);

        assertThat(status.state()).isEqualTo(JobState.COMPLETED);
        assertThat(store.count(CASE)).isEqualTo(1);
        assertThat(status.warnings()).singleElement().satisfies(w -> {
            assertThat(w.source()).isEqualTo("browser");
            assertThat(w.message()).isEqualTo(
                    "browser extractor failed: IllegalStateException: history database exploded");
        });
    }

    @Test
    void allExtractorsFailingShouldFailTheJob() {
        JobController jobs = controller(failing(ExtractorKind.BROWSER, "one"),
                failing(ExtractorKind.REGISTRY, "two"));

        JobStatus status = jobs.awaitTerminal(jobs.submit(CASE), WAIT);

        assertThat(status.state()).isEqualTo(JobState.FAILED);
        assertThat(status.errorMessage()).startsWith(JobController.ALL_FAILED)
                .contains("browser extractor failed", "registry extractor failed");
    }

    @Test
    void extractorWarningsShouldBeRecordedAgainstTheJob() {
        JobController jobs = controller(extractor(ExtractorKind.RECYCLE_BIN, (caseId, ctx) -> {
            ctx.warn("INFO2 /RECYCLER/INFO2: truncated");
            return Stream.empty();
        }));

        long jobId = jobs.submit(CASE);
        JobStatus status = jobs.awaitTerminal(jobId, WAIT);

        assertThat(status.state()).isEqualTo(JobState.COMPLETED);
        assertThat(jobs.warnings(jobId)).extracting(JobWarning::source, JobWarning::message)
                .containsExactly(tuple("recycle_bin", "INFO2 /RECYCLER/INFO2: truncated"));
        assertThatThrownBy(() -> jobs.warnings(9999)).isInstanceOf(JobNotFoundException.class);
    }
}
