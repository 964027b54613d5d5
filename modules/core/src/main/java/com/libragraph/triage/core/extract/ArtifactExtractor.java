package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.formats.filesystem.VolumeSet;

import java.util.stream.Stream;

/**
 * Decodes one family of evidence from a mounted image.
 *
 * <p>Implementations are independent of each other and read-only against the
 * volumes. The returned stream is lazy and finite; calling {@code extract}
 * again starts over from the image. A structure that is absent yields no
 * artifacts. A structure that is present but corrupt is reported through
 * {@link ExtractionContext#warn} and skipped. Exceptions escaping the stream
 * mark the whole extractor as failed.
 */
public interface ArtifactExtractor {

    ExtractorKind kind();

    Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx);
}
