package com.libragraph.triage.formats.filesystem.ntfs;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.formats.filesystem.MacbTimes;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * A decoded MFT file record, holding only what the walker needs:
 * flags, standard-information times, the preferred file name and the
 * unnamed data stream.
 */
public final class MftRecord {

    static final int FIXUP_STRIDE = 512;
    private static final byte[] SIGNATURE = "FILE".getBytes(StandardCharsets.US_ASCII);

    static final int ATTR_STANDARD_INFORMATION = 0x10;
    static final int ATTR_FILE_NAME = 0x30;
    static final int ATTR_DATA = 0x80;
    private static final long ATTR_END = 0xFFFFFFFFL;

    static final int FLAG_IN_USE = 0x01;
    static final int FLAG_DIRECTORY = 0x02;

    private static final int NAMESPACE_DOS = 2;

    private final long number;
    private final boolean fixupValid;
    private int flags;
    private long baseRecord;
    private MacbTimes times = MacbTimes.NONE;
    private String name;
    private int nameNamespace = -1;
    private long parent = -1;
    private long fileNameSize;
    private byte[] residentData;
    private List<DataRun> runs;
    private long dataSize;

    private MftRecord(long number, boolean fixupValid) {
        this.number = number;
        this.fixupValid = fixupValid;
    }

    public static boolean isEmpty(byte[] raw) {
        for (byte b : raw) {
            if (b != 0) return false;
        }
        return true;
    }

    /**
     * Decodes one record. A failed update-sequence check does not throw; the
     * record is parsed from its raw bytes and reported through {@link #fixupValid()}.
     *
     * @throws CorruptStructureException if the signature or attribute chain is invalid
     */
    public static MftRecord parse(byte[] raw, long number) {
        String structure = "MFT record " + number;
        if (!LittleEndian.startsWith(raw, 0, SIGNATURE)) {
            throw new CorruptStructureException(structure, "missing FILE signature");
        }
        byte[] fixed = Arrays.copyOf(raw, raw.length);
        boolean fixupValid = applyFixups(fixed);
        MftRecord record = new MftRecord(number, fixupValid);
        try {
            record.decode(fixupValid ? fixed : raw, structure);
        } catch (IndexOutOfBoundsException e) {
            throw new CorruptStructureException(structure, e.getMessage(), e);
        }
        return record;
    }

    /** Replaces the last two bytes of every 512-byte stride with the saved values. */
    static boolean applyFixups(byte[] b) {
        int usaOffset = LittleEndian.u16(b, 4);
        int usaCount = LittleEndian.u16(b, 6);
        if (usaCount == 0 || usaOffset + usaCount * 2 > b.length || (usaCount - 1) * FIXUP_STRIDE > b.length) {
            return false;
        }
        byte usn0 = b[usaOffset];
        byte usn1 = b[usaOffset + 1];
        boolean ok = true;
        for (int i = 1; i < usaCount; i++) {
            int pos = i * FIXUP_STRIDE - 2;
            if (b[pos] != usn0 || b[pos + 1] != usn1) {
                ok = false;
                continue;
            }
            b[pos] = b[usaOffset + 2 * i];
            b[pos + 1] = b[usaOffset + 2 * i + 1];
        }
        return ok;
    }

    private void decode(byte[] b, String structure) {
        flags = LittleEndian.u16(b, 0x16);
        baseRecord = LittleEndian.u48(b, 0x20);
        int off = LittleEndian.u16(b, 0x14);
        while (off + 8 <= b.length) {
            long type = LittleEndian.u32(b, off);
            if (type == ATTR_END) break;
            long length = LittleEndian.u32(b, off + 4);
            if (length < 16 || off + length > b.length) {
                throw new CorruptStructureException(structure, "attribute at " + off + " has length " + length);
            }
            boolean nonResident = LittleEndian.u8(b, off + 8) != 0;
            int nameLength = LittleEndian.u8(b, off + 9);
            int end = off + (int) length;
            switch ((int) type) {
                case ATTR_STANDARD_INFORMATION -> {
                    if (!nonResident) readStandardInformation(resident(b, off, end, structure));
                }
                case ATTR_FILE_NAME -> {
                    if (!nonResident) readFileName(resident(b, off, end, structure));
                }
                case ATTR_DATA -> {
                    if (nameLength == 0) readData(b, off, end, nonResident, structure);
                }
                default -> {
                    // other attributes are not needed
                }
            }
            off = end;
        }
    }

    private static byte[] resident(byte[] b, int off, int end, String structure) {
        long contentLength = LittleEndian.u32(b, off + 0x10);
        int contentOffset = LittleEndian.u16(b, off + 0x14);
        if (off + contentOffset + contentLength > end) {
            throw new CorruptStructureException(structure, "resident content overruns attribute at " + off);
        }
        return Arrays.copyOfRange(b, off + contentOffset, off + contentOffset + (int) contentLength);
    }

    private void readStandardInformation(byte[] c) {
        if (c.length < 32) return;
        times = new MacbTimes(time(c, 0), time(c, 8), time(c, 24), time(c, 16));
    }

    private void readFileName(byte[] c) {
        if (c.length < 0x42) return;
        int length = LittleEndian.u8(c, 0x40);
        int namespace = LittleEndian.u8(c, 0x41);
        // A DOS 8.3 alias never replaces a long name
        if (name != null && (namespace == NAMESPACE_DOS || nameNamespace != NAMESPACE_DOS)) return;
        name = LittleEndian.utf16(c, 0x42, length * 2);
        nameNamespace = namespace;
        parent = LittleEndian.u48(c, 0);
        fileNameSize = LittleEndian.i64(c, 0x30);
    }

    private void readData(byte[] b, int off, int end, boolean nonResident, String structure) {
        if (!nonResident) {
            residentData = resident(b, off, end, structure);
            dataSize = residentData.length;
            return;
        }
        if (LittleEndian.i64(b, off + 0x10) != 0) return; // later extent of a split attribute
        int runOffset = LittleEndian.u16(b, off + 0x20);
        dataSize = LittleEndian.i64(b, off + 0x30);
        runs = DataRun.decode(b, off + runOffset, end);
    }

    private static Instant time(byte[] c, int off) {
        return WindowsTime.fromFiletime(LittleEndian.i64(c, off)).orElse(null);
    }

    public long number() {
        return number;
    }

    public boolean fixupValid() {
        return fixupValid;
    }

    public boolean inUse() {
        return (flags & FLAG_IN_USE) != 0;
    }

    public boolean directory() {
        return (flags & FLAG_DIRECTORY) != 0;
    }

    /** Non-zero for extension records that belong to another base record. */
    public long baseRecord() {
        return baseRecord;
    }

    public MacbTimes times() {
        return times;
    }

    public String name() {
        return name;
    }

    public long parent() {
        return parent;
    }

    public boolean hasData() {
        return residentData != null || runs != null;
    }

    public byte[] residentData() {
        return residentData;
    }

    public List<DataRun> runs() {
        return runs;
    }

    /** Size of the unnamed data stream, falling back to the size recorded in the file name. */
    public long size() {
        return hasData() ? dataSize : fileNameSize;
    }
}
