package com.libragraph.triage.formats.recycle;

import java.time.Instant;

/**
 * Metadata of one recycled file, from a Vista+ {@code $I} file or an XP {@code INFO2} record.
 *
 * @param recycledName name of the file holding the content ({@code $R...} or {@code Dc<n>.<ext>})
 */
public record RecycledFile(String originalPath, Instant deletedAt, long size, String recycledName, int format) {

    public static final int FORMAT_INFO2 = 0;
    public static final int FORMAT_I_V1 = 1;
    public static final int FORMAT_I_V2 = 2;
}
