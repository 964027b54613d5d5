package com.libragraph.triage.core.anomaly;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.ArtifactCodec;
import com.libragraph.triage.core.cases.CaseNotFoundException;
import com.libragraph.triage.core.dao.AnomalyReportDao;
import com.libragraph.triage.core.dao.CaseDao;
import com.libragraph.triage.core.dao.JobDao;
import com.libragraph.triage.core.job.JobRecord;
import com.libragraph.triage.core.store.ArtifactStore;
import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.types.JobState;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scores a case's stored activity and records the outcome as an immutable
 * {@link AnomalyReport}.
 */
@ApplicationScoped
public class AnomalyDetectionEngine {

    private static final Logger log = Logger.getLogger(AnomalyDetectionEngine.class);

    /** Flagged activities listed in a report. */
    static final int MAX_FLAGGED = 50;
    static final double HIGH_CONFIDENCE = 0.8;

    @Inject
    Jdbi jdbi;

    @Inject
    ArtifactStore store;

    @Inject
    AnomalyScorer scorer;

    @Inject
    ArtifactCodec codec;

    @ConfigProperty(name = "triage.anomaly.severity-threshold", defaultValue = "0.7")
    double severityThreshold;

    @ConfigProperty(name = "triage.anomaly.temporal-window-seconds", defaultValue = "300")
    long temporalWindowSeconds;

    @ConfigProperty(name = "triage.anomaly.session-window-minutes", defaultValue = "30")
    long sessionWindowMinutes;

    @ConfigProperty(name = "triage.anomaly.top-k", defaultValue = "5")
    int topK;

    @ConfigProperty(name = "triage.anomaly.band.medium", defaultValue = "40")
    double bandMedium;

    @ConfigProperty(name = "triage.anomaly.band.high", defaultValue = "70")
    double bandHigh;

    @ConfigProperty(name = "triage.anomaly.band.critical", defaultValue = "90")
    double bandCritical;

    private AnomalySettings settings;
    private final Map<String, Object> caseLocks = new ConcurrentHashMap<>();

    public AnomalyDetectionEngine() {
    }

    public AnomalyDetectionEngine(Jdbi jdbi, ArtifactStore store, AnomalyScorer scorer, ArtifactCodec codec,
                                  AnomalySettings settings) {
        this.jdbi = jdbi;
        this.store = store;
        this.scorer = scorer;
        this.codec = codec;
        this.settings = settings;
    }

    @PostConstruct
    void init() {
        settings = new AnomalySettings(severityThreshold, Duration.ofSeconds(temporalWindowSeconds),
                Duration.ofMinutes(sessionWindowMinutes), topK, new RiskBands(bandMedium, bandHigh, bandCritical));
        log.infof("Anomaly detection using %s (threshold %.2f, bands %s)", scorer.name(),
                settings.severityThreshold(), settings.bands());
    }

    public AnomalySettings settings() {
        return settings;
    }

    /**
     * Analyzes the case's timestamped artifacts and stores a new report.
     *
     * @throws CaseNotFoundException      if the case is not registered
     * @throws AnalysisNotReadyException  if an extraction is active or none has completed
     * @throws InsufficientDataException if the case has no timestamped artifacts
     */
    public AnomalyReport analyze(String caseId) {
        synchronized (caseLocks.computeIfAbsent(caseId, k -> new Object())) {
            JobRecord job = requireReady(caseId);

            List<Artifact> artifacts;
            try (Stream<Artifact> timeline = store.timeline(caseId)) {
                artifacts = timeline.collect(Collectors.toList());
            }
            if (artifacts.isEmpty()) {
                throw new InsufficientDataException(caseId);
            }

            ActivityGraph graph = new ActivityGraphBuilder(settings).build(artifacts);
            ScoringResult scoring = scorer.score(graph);
            RiskAssessment risk = new RiskAggregator(settings).assess(graph, scoring);
            AnomalyReport report = report(caseId, job.id(), graph, scoring, risk);

            long id = jdbi.withExtension(AnomalyReportDao.class, dao -> dao.insert(caseId,
                    report.anomaliesDetected(), report.totalActivities(), report.modelAccuracy(),
                    report.riskLevel(), report.overallRiskScore(), report.scorer(), report.jobId(),
                    encode(report), report.generatedAt()));
            log.infof("Analysis of case %s: %d of %d activities anomalous, risk %.2f (%s), report %d",
                    caseId, report.anomaliesDetected(), report.totalActivities(), report.overallRiskScore(),
                    report.riskLevel(), id);
            return report.withId(id);
        }
    }

    public Optional<AnomalyReport> latest(String caseId) {
        return jdbi.withExtension(AnomalyReportDao.class, dao -> dao.findLatest(caseId)).map(this::decode);
    }

    public Optional<AnomalyReport> report(String caseId, long reportId) {
        return jdbi.withExtension(AnomalyReportDao.class, dao -> dao.findById(caseId, reportId)).map(this::decode);
    }

    /** Reports of the case, oldest first. */
    public List<AnomalyReport> history(String caseId) {
        return jdbi.withExtension(AnomalyReportDao.class, dao -> dao.findByCase(caseId)).stream()
                .map(this::decode)
                .collect(Collectors.toList());
    }

    private JobRecord requireReady(String caseId) {
        return jdbi.withHandle(handle -> {
            if (handle.attach(CaseDao.class).findById(caseId).isEmpty()) {
                throw new CaseNotFoundException(caseId);
            }
            JobDao jobs = handle.attach(JobDao.class);
            if (jobs.countInStates(caseId, JobState.QUEUED, JobState.RUNNING) > 0) {
                throw new AnalysisNotReadyException(caseId, "Extraction still in progress for case " + caseId);
            }
            return jobs.findLatestInState(caseId, JobState.COMPLETED).orElseThrow(() ->
                    new AnalysisNotReadyException(caseId, "No completed extraction for case " + caseId));
        });
    }

    private AnomalyReport report(String caseId, long jobId, ActivityGraph graph, ScoringResult scoring,
                                 RiskAssessment risk) {
        List<AnomalyReport.FlaggedActivity> flagged = new ArrayList<>();
        for (int i : risk.anomalous()) {
            if (flagged.size() == MAX_FLAGGED) break;
            ActivityNode node = graph.node(i);
            flagged.add(new AnomalyReport.FlaggedActivity(node.artifactId(), node.type(), node.timestamp(),
                    node.description(), scoring.score(i), node.indicators()));
        }

        Set<String> users = new HashSet<>();
        Set<ArtifactType> types = new HashSet<>();
        for (ActivityNode node : graph.nodes()) {
            if (node.profile() != null) users.add(node.profile());
            types.add(node.type());
        }
        int total = graph.size();
        int anomalous = risk.anomalous().size();
        AnomalyReport.FeaturesSummary features = new AnomalyReport.FeaturesSummary(total, users.size(),
                types.size(), (double) anomalous / total);

        return new AnomalyReport(null, caseId, jobId, Instant.now(), anomalous, total, scoring.confidence(),
                scoring.confidence() > HIGH_CONFIDENCE ? "High" : "Medium", risk.riskLevel(),
                risk.overallRiskScore(), scoring.scorer(), risk.criticalIndicators(), risk.recommendations(),
                risk.anomalousActivities(), risk.mostSuspiciousActivity(), flagged, features,
                new AnomalyReport.GraphSummary(graph.size(), graph.edgeCounts()));
    }

    private String encode(AnomalyReport report) {
        try {
            return codec.mapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot encode report for case " + report.caseId(), e);
        }
    }

    private AnomalyReport decode(ReportRow row) {
        try {
            return codec.mapper().readValue(row.body(), AnomalyReport.class).withId(row.id());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot decode anomaly report " + row.id(), e);
        }
    }
}
