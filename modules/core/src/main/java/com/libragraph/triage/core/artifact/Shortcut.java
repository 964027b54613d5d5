package com.libragraph.triage.core.artifact;

import java.time.Instant;

public record Shortcut(String profile, String linkPath, String targetPath, Instant targetCreated,
                       Instant targetAccessed, Instant targetModified, long targetSize, String arguments,
                       String workingDirectory, String volumeLabel) implements ArtifactPayload {

    @Override
    public String identity() {
        return targetPath;
    }
}
