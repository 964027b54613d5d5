package com.libragraph.triage.testing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Recycle-bin index records: Vista+ {@code $I} files and XP {@code INFO2}.
 */
public final class RecycleBinFixtures {

    private RecycleBinFixtures() {
    }

    /** Windows 10 layout: length-prefixed name at 28. */
    public static byte[] indexV2(String originalPath, long size, Instant deleted) {
        byte[] name = (originalPath + "\0").getBytes(StandardCharsets.UTF_16LE);
        ByteBuffer b = NtfsImageBuilder.le(ByteBuffer.allocate(28 + name.length));
        b.putLong(0, 2);
        b.putLong(8, size);
        b.putLong(16, NtfsImageBuilder.filetime(deleted));
        b.putInt(24, name.length / 2);
        b.put(28, name);
        return b.array();
    }

    /** Vista/7 layout: fixed 520-byte name at 24. */
    public static byte[] indexV1(String originalPath, long size, Instant deleted) {
        ByteBuffer b = NtfsImageBuilder.le(ByteBuffer.allocate(544));
        b.putLong(0, 1);
        b.putLong(8, size);
        b.putLong(16, NtfsImageBuilder.filetime(deleted));
        b.put(24, originalPath.getBytes(StandardCharsets.UTF_16LE));
        return b.array();
    }

    /** One INFO2 entry. A purged entry has its ANSI path blanked. */
    public record Info2Entry(String path, int index, int drive, Instant deleted, long size, boolean purged) {
    }

    public static byte[] info2(Info2Entry... entries) {
        ByteBuffer b = NtfsImageBuilder.le(ByteBuffer.allocate(20 + entries.length * 800));
        b.putInt(0, 5);
        b.putInt(12, 800);
        for (int i = 0; i < entries.length; i++) {
            Info2Entry e = entries[i];
            int off = 20 + i * 800;
            byte[] ansi = e.path().getBytes(StandardCharsets.ISO_8859_1);
            b.put(off, ansi, 0, Math.min(259, ansi.length));
            if (e.purged()) b.put(off, (byte) 0);
            b.putInt(off + 260, e.index());
            b.putInt(off + 264, e.drive());
            b.putLong(off + 268, NtfsImageBuilder.filetime(e.deleted()));
            b.putInt(off + 276, (int) e.size());
            byte[] unicode = e.path().getBytes(StandardCharsets.UTF_16LE);
            b.put(off + 280, unicode, 0, Math.min(518, unicode.length));
        }
        return b.array();
    }
}
