package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.types.RiskLevel;

import java.util.List;
import java.util.Map;

/**
 * Aggregated view of a scored graph.
 *
 * @param anomalous node indices at or above the severity threshold, highest score first
 */
public record RiskAssessment(
        List<Integer> anomalous,
        double overallRiskScore,
        RiskLevel riskLevel,
        List<String> criticalIndicators,
        List<String> recommendations,
        Map<String, Integer> anomalousActivities,
        String mostSuspiciousActivity
) {
}
