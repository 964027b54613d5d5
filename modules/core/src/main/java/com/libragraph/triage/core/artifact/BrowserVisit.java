package com.libragraph.triage.core.artifact;

import java.time.Instant;

public record BrowserVisit(String browser, String profile, String url, String title, long visitCount,
                           Instant visitTime) implements ArtifactPayload {
}
