package com.libragraph.triage.core.anomaly;

/**
 * Scores every node of an activity graph. The default implementation is
 * {@link GraphAttentionScorer}; another bean can replace it as a CDI
 * {@code @Alternative} with a {@code @Priority}.
 */
public interface AnomalyScorer {

    /** Name recorded on reports produced with this scorer. */
    String name();

    /**
     * @return one score in [0, 1] per node, in node order, with the scorer's own confidence
     */
    ScoringResult score(ActivityGraph graph);
}
