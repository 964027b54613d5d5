package com.libragraph.triage.core.anomaly;

import java.util.List;

/**
 * Output of an {@link AnomalyScorer}.
 *
 * @param confidence self-reported confidence in [0, 1]; reported as the model accuracy unchanged
 */
public record ScoringResult(List<Double> scores, double confidence, String scorer) {

    public ScoringResult {
        scores = List.copyOf(scores);
        for (double s : scores) {
            if (!(s >= 0 && s <= 1)) {
                throw new IllegalArgumentException("Node score out of [0, 1]: " + s);
            }
        }
        if (!(confidence >= 0 && confidence <= 1)) {
            throw new IllegalArgumentException("Confidence out of [0, 1]: " + confidence);
        }
    }

    public double score(int node) {
        return scores.get(node);
    }
}
