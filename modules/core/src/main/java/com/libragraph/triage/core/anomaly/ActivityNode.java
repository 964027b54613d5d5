package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.core.artifact.ArtifactPayload;
import com.libragraph.triage.types.ArtifactType;

import java.time.Instant;
import java.util.Set;

/**
 * One timestamped activity and the features the scorer sees.
 *
 * @param index      position in {@link ActivityGraph#nodes()}, which is timeline order
 * @param hour       hour of day, UTC
 * @param indicators suspicious traits detected while building the graph
 */
public record ActivityNode(
        int index,
        long artifactId,
        ArtifactType type,
        String category,
        Instant timestamp,
        int hour,
        boolean weekend,
        String profile,
        String identity,
        String sourcePath,
        String description,
        ArtifactPayload payload,
        Set<IndicatorCategory> indicators
) {
    public ActivityNode {
        indicators = Set.copyOf(indicators);
    }
}
