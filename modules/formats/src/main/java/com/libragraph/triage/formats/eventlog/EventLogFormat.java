package com.libragraph.triage.formats.eventlog;

import com.libragraph.triage.util.LittleEndian;

import java.nio.charset.StandardCharsets;

/**
 * Windows event log container types, told apart by their file header.
 */
public enum EventLogFormat {
    /** Legacy NT/XP {@code .evt}: {@code LfLe} at offset 4. */
    EVT,
    /** Vista+ {@code .evtx}: {@code ElfFile\0} chunks of binary XML. */
    EVTX,
    UNKNOWN;

    private static final byte[] LFLE = "LfLe".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] ELFFILE = "ElfFile\0".getBytes(StandardCharsets.US_ASCII);

    public static EventLogFormat detect(byte[] header) {
        if (LittleEndian.startsWith(header, 4, LFLE)) return EVT;
        if (LittleEndian.startsWith(header, 0, ELFFILE)) return EVTX;
        return UNKNOWN;
    }
}
