package com.libragraph.triage.core.anomaly;

import java.time.Duration;

/**
 * Tunables of graph construction and risk aggregation.
 *
 * @param severityThreshold node score at or above which a node is anomalous
 * @param topK              number of highest anomalous scores averaged into the peak component
 */
public record AnomalySettings(
        double severityThreshold,
        Duration temporalWindow,
        Duration sessionWindow,
        int topK,
        RiskBands bands
) {
    public static final AnomalySettings DEFAULTS = new AnomalySettings(
            0.7, Duration.ofSeconds(300), Duration.ofMinutes(30), 5, RiskBands.DEFAULT);

    public AnomalySettings {
        if (!(severityThreshold > 0 && severityThreshold <= 1)) {
            throw new IllegalArgumentException("Severity threshold must be in (0, 1], got " + severityThreshold);
        }
        if (temporalWindow.isNegative() || temporalWindow.isZero()) {
            throw new IllegalArgumentException("Temporal window must be positive");
        }
        if (sessionWindow.isNegative() || sessionWindow.isZero()) {
            throw new IllegalArgumentException("Session window must be positive");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("top-k must be at least 1, got " + topK);
        }
    }
}
