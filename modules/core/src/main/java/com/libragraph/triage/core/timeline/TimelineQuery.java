package com.libragraph.triage.core.timeline;

import com.libragraph.triage.types.ArtifactType;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * @param from  inclusive lower bound, or null
 * @param to    exclusive upper bound, or null
 * @param types types to include; empty means all
 * @param limit maximum events, 0 for no limit
 */
public record TimelineQuery(Instant from, Instant to, Set<ArtifactType> types, int limit, int offset) {

    public static final TimelineQuery ALL = new TimelineQuery(null, null, Set.of(), 0, 0);

    public TimelineQuery {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(types));
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must be >= 0");
        }
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + from + " .. " + to);
        }
    }
}
