package com.libragraph.triage.core.artifact;

import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.util.ContentHash;

import java.time.Instant;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * One evidence record of a case.
 *
 * @param id          store identifier, null until stored
 * @param naturalKey  type-specific identity within the case; see {@link #key(Object...)}
 * @param timestamp   position on the case timeline, null for untimed records
 * @param sourcePath  provenance: volume-qualified path of the file the record was decoded from
 */
public record Artifact(
        Long id,
        String caseId,
        ArtifactType type,
        String naturalKey,
        Instant timestamp,
        String sourcePath,
        String description,
        ArtifactPayload payload
) {
    public Artifact {
        Objects.requireNonNull(caseId, "caseId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(naturalKey, "naturalKey");
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(payload, "payload");
        if (description == null) description = "";
    }

    public static Artifact of(String caseId, ArtifactType type, String naturalKey, Instant timestamp,
                              String sourcePath, String description, ArtifactPayload payload) {
        return new Artifact(null, caseId, type, naturalKey, timestamp, sourcePath, description, payload);
    }

    /**
     * Joins key components with {@code |}. Nulls become empty components, so
     * keys with the same arity stay comparable.
     */
    public static String key(Object... parts) {
        StringJoiner joiner = new StringJoiner("|");
        for (Object part : parts) {
            joiner.add(part == null ? "" : part.toString());
        }
        return joiner.toString();
    }

    public ContentHash keyHash() {
        return ContentHash.of(naturalKey);
    }

    public Artifact withId(long newId) {
        return new Artifact(newId, caseId, type, naturalKey, timestamp, sourcePath, description, payload);
    }

    public Artifact withPayload(ArtifactPayload newPayload, Instant newTimestamp, String newDescription) {
        return new Artifact(id, caseId, type, naturalKey, newTimestamp, sourcePath, newDescription, newPayload);
    }
}
