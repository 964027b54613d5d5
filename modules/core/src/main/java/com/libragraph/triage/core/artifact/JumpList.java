package com.libragraph.triage.core.artifact;

import java.time.Instant;

/**
 * A jump-list file, recorded from its metadata.
 *
 * @param listKind {@code automatic} or {@code custom}
 */
public record JumpList(String profile, String path, String appId, String listKind, long size, Instant modified)
        implements ArtifactPayload {
}
