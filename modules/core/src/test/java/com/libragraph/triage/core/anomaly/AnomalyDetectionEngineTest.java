package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.core.TestDatabase;
import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.SystemSetting;
import com.libragraph.triage.core.cases.CaseNotFoundException;
import com.libragraph.triage.core.dao.JobDao;
import com.libragraph.triage.core.store.ArtifactStore;
import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.types.JobState;
import com.libragraph.triage.types.RiskLevel;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.libragraph.triage.core.anomaly.Activities.*;
import static org.assertj.core.api.Assertions.*;

class AnomalyDetectionEngineTest {

    private static final String CASE = "case-a";
    /** Tuesday. */
    private static final Instant WORKDAY = Instant.parse("2021-05-04T09:00:00Z");
    private static final Instant NIGHT = Instant.parse("2021-05-04T03:00:00Z");

    private Jdbi jdbi;
    private ArtifactStore store;
    private AnomalyDetectionEngine engine;

    @BeforeEach
    void setUp() {
        jdbi = TestDatabase.create();
        store = new ArtifactStore(jdbi, TestDatabase.codec());
        engine = new AnomalyDetectionEngine(jdbi, store, new GraphAttentionScorer(0.7), TestDatabase.codec(),
                AnomalySettings.DEFAULTS);
        TestDatabase.insertCase(jdbi, CASE);
    }

    private long job(JobState state) {
        Instant now = Instant.now();
        return jdbi.withExtension(JobDao.class, dao -> {
            long id = dao.insert(CASE, JobState.QUEUED, now);
            if (state != JobState.QUEUED) dao.markRunning(id, now, JobState.QUEUED, JobState.RUNNING);
            if (state == JobState.COMPLETED) dao.complete(id, now, JobState.RUNNING, JobState.COMPLETED);
            return id;
        });
    }

    /** 88 daytime service events and a burst of 12 failed logons at night. */
    private void storeIntrusionNight() {
        for (int i = 0; i < 88; i++) {
            store.upsert(serviceEvent(CASE, i, WORKDAY.plusSeconds(120L * i)));
        }
        for (int i = 0; i < 12; i++) {
            store.upsert(failedLogon(CASE, 1000 + i, NIGHT.plusSeconds(60L * i), "mallory"));
        }
    }

    @Test
    void failedLogonBurstShouldBeTheOnlyAnomalies() {
        long jobId = job(JobState.COMPLETED);
        storeIntrusionNight();

        AnomalyReport report = engine.analyze(CASE);

        assertThat(report.id()).isNotNull();
        assertThat(report.jobId()).isEqualTo(jobId);
        assertThat(report.totalActivities()).isEqualTo(100);
        assertThat(report.anomaliesDetected()).isEqualTo(12);
        assertThat(report.criticalIndicators()).isNotEmpty().contains(
                "Activity outside business hours (12)",
                "Failed logon attempts (12)",
                "Bursts of failed logons (possible password guessing) (12)");
        assertThat(report.riskLevel()).isEqualTo(RiskBands.DEFAULT.classify(report.overallRiskScore()));
        assertThat(report.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(report.recommendations()).startsWith(RiskAggregator.ESCALATE);
        assertThat(report.anomalousActivities()).containsEntry("event_log", 12);
        assertThat(report.mostSuspiciousActivity()).isEqualTo("event_log");
        assertThat(report.flaggedActivities()).hasSize(12)
                .allSatisfy(f -> {
                    assertThat(f.score()).isGreaterThanOrEqualTo(0.7);
                    assertThat(f.timestamp()).isBefore(WORKDAY);
                    assertThat(f.artifactId()).isPositive();
                });
        assertThat(report.modelAccuracy()).isEqualTo(1.0);
        assertThat(report.analysisConfidence()).isEqualTo("High");
        assertThat(report.featuresSummary().uniqueUsers()).isEqualTo(1);
        assertThat(report.featuresSummary().anomalyRate()).isCloseTo(0.12, within(1e-9));
        assertThat(report.graph().nodes()).isEqualTo(100);
    }

    @Test
    void reportsShouldAccumulateAndReadBackUnchanged() {
        job(JobState.COMPLETED);
        storeIntrusionNight();

        AnomalyReport first = engine.analyze(CASE);
        store.upsert(usb(CASE, "LATE-STICK", Instant.parse("2021-05-04T23:30:00Z")));
        AnomalyReport second = engine.analyze(CASE);

        assertThat(second.id()).isGreaterThan(first.id());
        assertThat(second.totalActivities()).isEqualTo(101);
        assertThat(engine.history(CASE)).extracting(AnomalyReport::id).containsExactly(first.id(), second.id());
        assertThat(engine.latest(CASE)).hasValueSatisfying(r -> assertThat(r.id()).isEqualTo(second.id()));
        assertThat(engine.report(CASE, first.id())).hasValueSatisfying(r -> {
            assertThat(r.totalActivities()).isEqualTo(100);
            assertThat(r.anomaliesDetected()).isEqualTo(first.anomaliesDetected());
            assertThat(r.overallRiskScore()).isEqualTo(first.overallRiskScore());
            assertThat(r.criticalIndicators()).isEqualTo(first.criticalIndicators());
            assertThat(r.generatedAt()).isEqualTo(first.generatedAt());
        });
        assertThat(engine.report("other-case", first.id())).isEmpty();
    }

    @Test
    void caseWithoutReportsShouldHaveNoLatest() {
        assertThat(engine.latest(CASE)).isEmpty();
        assertThat(engine.history(CASE)).isEmpty();
    }

    @Test
    void untimedArtifactsAloneShouldBeInsufficient() {
        job(JobState.COMPLETED);
        store.upsert(Artifact.of(CASE, ArtifactType.SYSTEM_SETTING, "ComputerName", null, "vol0:SYSTEM",
                "Computer name", new SystemSetting("Computer name", "WS01", "SYSTEM")));

        assertThatThrownBy(() -> engine.analyze(CASE))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessage("Case case-a has no timestamped artifacts to analyze");
        assertThat(engine.latest(CASE)).isEmpty();
    }

    @Test
    void analysisShouldWaitForACompletedExtraction() {
        assertThatThrownBy(() -> engine.analyze(CASE))
                .isInstanceOf(AnalysisNotReadyException.class)
                .hasMessage("No completed extraction for case case-a");

        job(JobState.COMPLETED);
        job(JobState.RUNNING);
        storeIntrusionNight();

        assertThatThrownBy(() -> engine.analyze(CASE))
                .isInstanceOf(AnalysisNotReadyException.class)
                .hasMessage("Extraction still in progress for case case-a");
    }

    @Test
    void unknownCaseShouldBeRejected() {
        assertThatThrownBy(() -> engine.analyze("nope"))
                .isInstanceOf(CaseNotFoundException.class);
    }
}
