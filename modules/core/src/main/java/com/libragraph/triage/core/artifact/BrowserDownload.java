package com.libragraph.triage.core.artifact;

import java.time.Instant;
import java.util.Locale;

public record BrowserDownload(String browser, String profile, String url, String targetPath, long totalBytes,
                              Instant startTime, Instant endTime) implements ArtifactPayload {

    /** Whether the saved file is something Windows would execute. */
    public boolean executable() {
        if (targetPath == null) return false;
        String lower = targetPath.toLowerCase(Locale.ROOT);
        return lower.endsWith(".exe") || lower.endsWith(".msi") || lower.endsWith(".bat")
                || lower.endsWith(".cmd") || lower.endsWith(".ps1") || lower.endsWith(".scr")
                || lower.endsWith(".dll") || lower.endsWith(".vbs") || lower.endsWith(".js");
    }
}
