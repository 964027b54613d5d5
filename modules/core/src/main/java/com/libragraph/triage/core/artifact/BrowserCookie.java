package com.libragraph.triage.core.artifact;

import java.time.Instant;

public record BrowserCookie(String browser, String profile, String host, String name, String path,
                            Instant created, Instant expires, Instant lastAccessed) implements ArtifactPayload {
}
