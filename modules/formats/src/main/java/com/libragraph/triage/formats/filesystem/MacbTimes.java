package com.libragraph.triage.formats.filesystem;

import java.time.Instant;

/**
 * Modified, accessed, changed (metadata) and born timestamps of a filesystem entry.
 * Any component may be null when the filesystem did not record a plausible value.
 */
public record MacbTimes(Instant created, Instant modified, Instant accessed, Instant changed) {

    public static final MacbTimes NONE = new MacbTimes(null, null, null, null);
}
