package com.libragraph.triage.core.artifact;

import java.time.Instant;

public record InstalledProgram(String name, String version, String publisher, String installLocation,
                               Instant installDate, String registryPath) implements ArtifactPayload {

    @Override
    public String identity() {
        return name;
    }
}
