package com.libragraph.triage.formats.eventlog;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Legacy {@code .evt} event log decoding.
 *
 * <p>Records are scanned from the end of the 48-byte file header. The file is
 * a circular buffer, so garbage between records (wrapped or overwritten
 * space) is skipped by searching for the next {@code LfLe} signature whose
 * leading and trailing lengths agree.
 *
 * @param records     decoded records in file order
 * @param skippedRuns number of places where unreadable bytes were skipped
 */
public record EvtLog(List<EvtRecord> records, int skippedRuns) {

    static final int HEADER_SIZE = 0x30;
    static final int MIN_RECORD = 0x38;
    static final int CURSOR_SIZE = 0x28;
    private static final byte[] LFLE = "LfLe".getBytes(StandardCharsets.US_ASCII);
    private static final int MAX_STRINGS = 256;

    /**
     * @throws CorruptStructureException if the file header is not an event log header
     */
    public static EvtLog parse(byte[] data) {
        if (EventLogFormat.detect(data) != EventLogFormat.EVT || LittleEndian.u32(data, 0) != HEADER_SIZE) {
            throw new CorruptStructureException("event log", "missing LfLe file header");
        }
        List<EvtRecord> records = new ArrayList<>();
        int skipped = 0;
        boolean skipping = false;
        int pos = HEADER_SIZE;
        while (pos + MIN_RECORD <= data.length) {
            int length = LittleEndian.i32(data, pos);
            if (isEndCursor(data, pos)) {
                pos += CURSOR_SIZE;
                continue;
            }
            if (LittleEndian.startsWith(data, pos + 4, LFLE) && length >= MIN_RECORD && pos + length <= data.length
                    && LittleEndian.i32(data, pos + length - 4) == length) {
                try {
                    records.add(record(data, pos, length));
                    skipping = false;
                    pos += length;
                    continue;
                } catch (IndexOutOfBoundsException e) {
                    // falls through to resynchronisation
                }
            }
            if (!skipping) {
                skipped++;
                skipping = true;
            }
            pos++;
        }
        return new EvtLog(List.copyOf(records), skipped);
    }

    /** The 40-byte end-of-file cursor is marked by the sequence 0x11111111 .. 0x44444444. */
    private static boolean isEndCursor(byte[] d, int pos) {
        return pos + CURSOR_SIZE <= d.length && LittleEndian.i32(d, pos) == CURSOR_SIZE
                && LittleEndian.u32(d, pos + 4) == 0x11111111L && LittleEndian.u32(d, pos + 8) == 0x22222222L
                && LittleEndian.u32(d, pos + 12) == 0x33333333L && LittleEndian.u32(d, pos + 16) == 0x44444444L;
    }

    private static EvtRecord record(byte[] d, int off, int length) {
        long number = LittleEndian.u32(d, off + 8);
        long generated = LittleEndian.u32(d, off + 12);
        long written = LittleEndian.u32(d, off + 16);
        int eventId = (int) (LittleEndian.u32(d, off + 20) & 0xFFFF);
        int type = LittleEndian.u16(d, off + 24);
        int stringCount = Math.min(LittleEndian.u16(d, off + 26), MAX_STRINGS);
        int category = LittleEndian.u16(d, off + 28);
        int stringOffset = (int) LittleEndian.u32(d, off + 36);

        byte[] rec = new byte[length];
        System.arraycopy(d, off, rec, 0, length);
        String source = LittleEndian.utf16z(rec, 56);
        String computer = LittleEndian.utf16z(rec, 56 + (source.length() + 1) * 2);

        List<String> strings = new ArrayList<>();
        int p = stringOffset;
        for (int i = 0; i < stringCount && p > 0 && p < length - 4; i++) {
            String s = LittleEndian.utf16z(rec, p);
            strings.add(s);
            p += (s.length() + 1) * 2;
        }
        return new EvtRecord(number,
                WindowsTime.fromUnixSeconds(generated).orElse(null),
                WindowsTime.fromUnixSeconds(written).orElse(null),
                eventId, type, category, source, computer, List.copyOf(strings));
    }
}
