package com.libragraph.triage.api;

import com.libragraph.triage.core.extract.ExtractorRegistry;
import com.libragraph.triage.core.job.JobController;
import com.libragraph.triage.core.job.JobExecutorProducer;
import com.libragraph.triage.core.job.JobStatus;
import com.libragraph.triage.core.job.WorkerPool;
import com.libragraph.triage.formats.image.ImageIngestor;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Liveness and load of the extraction pipeline.
 */
@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @Inject
    JobController jobs;

    @Inject
    JobExecutorProducer executors;

    @Inject
    ExtractorRegistry extractors;

    @Inject
    ImageIngestor ingestor;

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    public record Ping(String status, int activeJobs, int liveRuns) {
    }

    public record PipelineInfo(String name, String version, int workers, long jobTimeoutMinutes,
                               List<String> extractors, List<String> imageFormats) {
    }

    public record ActiveJob(long jobId, String state, long artifactsExtracted, long artifactsStored,
                            Instant startedAt) {
    }

    /**
     * @param stopping jobs already recorded as terminal whose threads are still exiting
     */
    public record JobLoad(Map<String, List<ActiveJob>> activeByCase, List<Long> stopping, List<WorkerPool> pools) {
    }

    @GET
    @Path("/ping")
    public Ping ping() {
        return new Ping("ok", jobs.activeJobs().size(), jobs.liveJobIds().size());
    }

    @GET
    @Path("/info")
    public PipelineInfo info() {
        return new PipelineInfo(appName, appVersion, executors.workerCount(), jobs.timeoutMinutes(),
                extractors.all().stream().map(e -> e.kind().label()).collect(Collectors.toList()),
                ingestor.formats().stream().map(f -> f.format().label()).collect(Collectors.toList()));
    }

    @GET
    @Path("/jobs")
    public JobLoad jobs() {
        List<JobStatus> active = jobs.activeJobs();
        Map<String, List<ActiveJob>> byCase = active.stream().collect(Collectors.groupingBy(JobStatus::caseId,
                TreeMap::new, Collectors.mapping(DiagnosticResource::describe, Collectors.toList())));
        List<Long> activeIds = active.stream().map(JobStatus::jobId).collect(Collectors.toList());
        List<Long> stopping = jobs.liveJobIds().stream()
                .filter(id -> !activeIds.contains(id))
                .collect(Collectors.toList());
        return new JobLoad(byCase, stopping, executors.pools());
    }

    static ActiveJob describe(JobStatus job) {
        return new ActiveJob(job.jobId(), job.state().label(), job.artifactsExtracted(), job.artifactsStored(),
                job.startedAt());
    }
}
