package com.libragraph.triage.core.anomaly;

/** Relations between activities, with their attention weight. */
public enum EdgeType {
    /** Consecutive events within the temporal window. */
    TEMPORAL(1.0),
    /** Consecutive events of the same user within the session window. */
    SAME_SESSION(0.8),
    /** Decoded from the same file. */
    SAME_SOURCE(0.5),
    /** About the same device, program or path. */
    SAME_IDENTITY(1.2);

    private final double weight;

    EdgeType(double weight) {
        this.weight = weight;
    }

    public double weight() {
        return weight;
    }
}
