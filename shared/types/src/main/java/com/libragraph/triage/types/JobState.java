package com.libragraph.triage.types;

/**
 * Lifecycle of an extraction job. Only QUEUED and RUNNING count as active;
 * COMPLETED and FAILED are terminal.
 */
public enum JobState {
    QUEUED(0, "queued"),
    RUNNING(1, "running"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed");

    private final int id;
    private final String label;

    JobState(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public static JobState fromId(int id) {
        for (JobState s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown JobState id: " + id);
    }
}
