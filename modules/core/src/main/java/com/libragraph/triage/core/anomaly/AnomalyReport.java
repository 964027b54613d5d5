package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.types.RiskLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one analysis run. Reports are never updated; every run stores a
 * new one.
 *
 * @param id            database id, null until stored
 * @param jobId         latest completed extraction job when the analysis ran
 * @param modelAccuracy the scorer's self-reported confidence
 */
public record AnomalyReport(
        Long id,
        String caseId,
        Long jobId,
        Instant generatedAt,
        int anomaliesDetected,
        int totalActivities,
        double modelAccuracy,
        String analysisConfidence,
        RiskLevel riskLevel,
        double overallRiskScore,
        String scorer,
        List<String> criticalIndicators,
        List<String> recommendations,
        Map<String, Integer> anomalousActivities,
        String mostSuspiciousActivity,
        List<FlaggedActivity> flaggedActivities,
        FeaturesSummary featuresSummary,
        GraphSummary graph
) {
    public AnomalyReport {
        criticalIndicators = List.copyOf(criticalIndicators);
        recommendations = List.copyOf(recommendations);
        anomalousActivities = Map.copyOf(anomalousActivities);
        flaggedActivities = List.copyOf(flaggedActivities);
    }

    public AnomalyReport withId(long newId) {
        return new AnomalyReport(newId, caseId, jobId, generatedAt, anomaliesDetected, totalActivities,
                modelAccuracy, analysisConfidence, riskLevel, overallRiskScore, scorer, criticalIndicators,
                recommendations, anomalousActivities, mostSuspiciousActivity, flaggedActivities, featuresSummary,
                graph);
    }

    /** An anomalous activity, highest scores first. */
    public record FlaggedActivity(long artifactId, ArtifactType type, Instant timestamp, String description,
                                  double score, Set<IndicatorCategory> indicators) {
    }

    public record FeaturesSummary(int totalRecords, int uniqueUsers, int activityTypes, double anomalyRate) {
    }

    public record GraphSummary(int nodes, Map<EdgeType, Integer> edges) {
    }
}
