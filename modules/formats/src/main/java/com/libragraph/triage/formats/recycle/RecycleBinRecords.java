package com.libragraph.triage.formats.recycle;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoders for recycle-bin index formats.
 */
public final class RecycleBinRecords {

    static final int INFO2_HEADER = 20;
    static final int INFO2_RECORD = 800;
    private static final int I_V1_NAME_BYTES = 520;

    private RecycleBinRecords() {
    }

    /**
     * Decodes a {@code $I} file. The content lives in the sibling whose name
     * swaps the {@code $I} prefix for {@code $R}.
     *
     * @throws CorruptStructureException on an unknown version or truncated name
     */
    public static RecycledFile parseIndexFile(String fileName, byte[] d) {
        try {
            long version = LittleEndian.i64(d, 0);
            long size = LittleEndian.i64(d, 8);
            Instant deleted = WindowsTime.fromFiletime(LittleEndian.i64(d, 16)).orElse(null);
            String name;
            int format;
            if (version == 1) {
                name = LittleEndian.utf16(d, 24, Math.min(I_V1_NAME_BYTES, d.length - 24));
                format = RecycledFile.FORMAT_I_V1;
            } else if (version == 2) {
                long chars = LittleEndian.u32(d, 24);
                if (chars > 32768) {
                    throw new CorruptStructureException("$I file " + fileName, "name length " + chars);
                }
                name = LittleEndian.utf16(d, 28, (int) chars * 2);
                format = RecycledFile.FORMAT_I_V2;
            } else {
                throw new CorruptStructureException("$I file " + fileName, "unknown version " + version);
            }
            return new RecycledFile(name, deleted, size, contentName(fileName), format);
        } catch (IndexOutOfBoundsException e) {
            throw new CorruptStructureException("$I file " + fileName, "truncated", e);
        }
    }

    public static String contentName(String indexFileName) {
        return indexFileName.length() > 2 && indexFileName.regionMatches(true, 0, "$I", 0, 2)
                ? "$R" + indexFileName.substring(2) : indexFileName;
    }

    /**
     * Decodes an XP {@code INFO2} index. Records whose ANSI path starts with
     * NUL were restored or purged and are dropped.
     *
     * @throws CorruptStructureException if the header declares an impossible record size
     */
    public static List<RecycledFile> parseInfo2(byte[] d) {
        if (d.length < INFO2_HEADER) {
            throw new CorruptStructureException("INFO2", "file shorter than its header");
        }
        long recordSize = LittleEndian.u32(d, 12);
        if (recordSize != INFO2_RECORD) {
            throw new CorruptStructureException("INFO2", "unsupported record size " + recordSize);
        }
        List<RecycledFile> out = new ArrayList<>();
        for (int off = INFO2_HEADER; off + INFO2_RECORD <= d.length; off += INFO2_RECORD) {
            if (d[off] == 0) continue;
            String ansi = LittleEndian.ascii(d, off, 260);
            long index = LittleEndian.u32(d, off + 260);
            long drive = LittleEndian.u32(d, off + 264);
            Instant deleted = WindowsTime.fromFiletime(LittleEndian.i64(d, off + 268)).orElse(null);
            long size = LittleEndian.u32(d, off + 276);
            String unicode = LittleEndian.utf16(d, off + 280, 520);
            String path = !unicode.isEmpty() ? unicode : ansi;
            out.add(new RecycledFile(path, deleted, size, recycledName(drive, index, path), RecycledFile.FORMAT_INFO2));
        }
        return out;
    }

    /** XP names recycled content {@code D<drive letter><index><extension>}. */
    static String recycledName(long drive, long index, String path) {
        char letter = (char) ('a' + (int) Math.min(drive, 25));
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('\\');
        String ext = dot > slash ? path.substring(dot) : "";
        return "D" + letter + index + ext;
    }
}
