package com.libragraph.triage.core.artifact;

import java.time.Instant;

/** One recorded run of a prefetched executable. */
public record PrefetchRun(String executable, long runCount, Instant runTime, int version, String pathHash)
        implements ArtifactPayload {

    @Override
    public String identity() {
        return executable;
    }
}
