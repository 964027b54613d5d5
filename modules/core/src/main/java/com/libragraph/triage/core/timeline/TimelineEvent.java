package com.libragraph.triage.core.timeline;

import com.libragraph.triage.types.ArtifactType;

import java.time.Instant;

/**
 * Projection of one timestamped artifact onto the case timeline.
 *
 * @param artifactId back-reference to the originating artifact
 */
public record TimelineEvent(String caseId, Instant timestamp, ArtifactType type, String description,
                            long artifactId, String naturalKey) {
}
