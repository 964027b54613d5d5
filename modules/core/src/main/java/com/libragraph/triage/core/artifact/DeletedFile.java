package com.libragraph.triage.core.artifact;

import java.time.Instant;

/**
 * A deleted file known from recycle-bin metadata or a freed MFT record.
 *
 * @param source       {@code recycle_bin} or {@code mft}
 * @param recycledName name of the content file in the bin, null for MFT records
 * @param profile      SID folder of the recycle bin, or null
 */
public record DeletedFile(String originalPath, long size, Instant deletedAt, String source,
                          boolean contentRecoverable, String recycledName, String profile)
        implements ArtifactPayload {

    public static final String SOURCE_RECYCLE_BIN = "recycle_bin";
    public static final String SOURCE_MFT = "mft";

    @Override
    public String identity() {
        return originalPath;
    }
}
