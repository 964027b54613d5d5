package com.libragraph.triage.core.artifact;

import java.time.Instant;

/** A UserAssist counter. */
public record ExecutionCount(String profile, String program, long runCount, Instant lastRun)
        implements ArtifactPayload {

    @Override
    public String identity() {
        return program;
    }
}
