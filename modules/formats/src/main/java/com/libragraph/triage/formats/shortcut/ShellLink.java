package com.libragraph.triage.formats.shortcut;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.time.Instant;

/**
 * Windows shell link ({@code .lnk}) header, LinkInfo and string data.
 *
 * @param targetPath local base path joined with the common path suffix, or null
 *                   when the link carries no LinkInfo
 */
public record ShellLink(int flags, long fileAttributes, Instant targetCreated, Instant targetAccessed,
                        Instant targetModified, long targetSize, String targetPath, String volumeLabel,
                        String relativePath, String workingDirectory, String arguments) {

    static final int HEADER_SIZE = 0x4C;
    private static final byte[] LINK_CLSID = {
            0x01, 0x14, 0x02, 0x00, 0x00, 0x00, 0x00, 0x00, (byte) 0xC0, 0x00, 0x00, 0x00, 0x00, 0x00, 0x00, 0x46};

    static final int HAS_ID_LIST = 0x01;
    static final int HAS_LINK_INFO = 0x02;
    static final int HAS_NAME = 0x04;
    static final int HAS_RELATIVE_PATH = 0x08;
    static final int HAS_WORKING_DIR = 0x10;
    static final int HAS_ARGUMENTS = 0x20;
    static final int HAS_ICON = 0x40;
    static final int IS_UNICODE = 0x80;

    private static final int VOLUME_ID_AND_LOCAL_BASE_PATH = 0x01;

    public static boolean isShellLink(byte[] header) {
        return header.length >= HEADER_SIZE && LittleEndian.u32(header, 0) == HEADER_SIZE
                && LittleEndian.startsWith(header, 4, LINK_CLSID);
    }

    /**
     * @throws CorruptStructureException if the header is invalid or a section overruns the file
     */
    public static ShellLink parse(byte[] d) {
        if (!isShellLink(d)) {
            throw new CorruptStructureException("shell link", "invalid header");
        }
        try {
            int flags = (int) LittleEndian.u32(d, 0x14);
            long attributes = LittleEndian.u32(d, 0x18);
            Instant created = WindowsTime.fromFiletime(LittleEndian.i64(d, 0x1C)).orElse(null);
            Instant accessed = WindowsTime.fromFiletime(LittleEndian.i64(d, 0x24)).orElse(null);
            Instant modified = WindowsTime.fromFiletime(LittleEndian.i64(d, 0x2C)).orElse(null);
            long size = LittleEndian.u32(d, 0x34);

            int pos = HEADER_SIZE;
            if ((flags & HAS_ID_LIST) != 0) {
                pos += 2 + LittleEndian.u16(d, pos);
            }
            String target = null;
            String label = null;
            if ((flags & HAS_LINK_INFO) != 0) {
                int infoSize = (int) LittleEndian.u32(d, pos);
                int infoFlags = (int) LittleEndian.u32(d, pos + 8);
                if ((infoFlags & VOLUME_ID_AND_LOCAL_BASE_PATH) != 0) {
                    int volumeId = pos + (int) LittleEndian.u32(d, pos + 12);
                    String base = LittleEndian.ascii(d, pos + (int) LittleEndian.u32(d, pos + 16),
                            Math.min(260, d.length - pos - (int) LittleEndian.u32(d, pos + 16)));
                    String suffix = LittleEndian.ascii(d, pos + (int) LittleEndian.u32(d, pos + 24),
                            Math.min(260, d.length - pos - (int) LittleEndian.u32(d, pos + 24)));
                    target = suffix.isEmpty() ? base : joinPath(base, suffix);
                    label = volumeLabel(d, volumeId);
                }
                pos += infoSize;
            }
            boolean unicode = (flags & IS_UNICODE) != 0;
            String[] strings = new String[5];
            int[] order = {HAS_NAME, HAS_RELATIVE_PATH, HAS_WORKING_DIR, HAS_ARGUMENTS, HAS_ICON};
            for (int i = 0; i < order.length; i++) {
                if ((flags & order[i]) == 0) continue;
                int chars = LittleEndian.u16(d, pos);
                int bytes = unicode ? chars * 2 : chars;
                strings[i] = unicode ? LittleEndian.utf16(d, pos + 2, bytes) : LittleEndian.ascii(d, pos + 2, bytes);
                pos += 2 + bytes;
            }
            return new ShellLink(flags, attributes, created, accessed, modified, size, target, label,
                    strings[1], strings[2], strings[3]);
        } catch (IndexOutOfBoundsException e) {
            throw new CorruptStructureException("shell link", e.getMessage(), e);
        }
    }

    private static String volumeLabel(byte[] d, int volumeId) {
        int labelOffset = (int) LittleEndian.u32(d, volumeId + 12);
        int at = volumeId + labelOffset;
        return at < d.length ? LittleEndian.ascii(d, at, Math.min(64, d.length - at)) : null;
    }

    private static String joinPath(String base, String suffix) {
        return base.endsWith("\\") ? base + suffix : base + "\\" + suffix;
    }
}
