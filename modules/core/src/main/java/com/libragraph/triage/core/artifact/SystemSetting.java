package com.libragraph.triage.core.artifact;

public record SystemSetting(String name, String value, String registryPath) implements ArtifactPayload {
}
