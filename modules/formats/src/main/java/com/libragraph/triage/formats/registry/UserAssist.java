package com.libragraph.triage.formats.registry;

import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.time.Instant;
import java.util.Optional;

/**
 * Decoding of UserAssist {@code Count} values: names are ROT13, data is a
 * 72-byte record on Windows 7 and later or a 16-byte record on XP.
 */
public final class UserAssist {

    public record Entry(String program, long runCount, Instant lastRun) {
    }

    private static final int WIN7_SIZE = 72;
    private static final int XP_SIZE = 16;

    private UserAssist() {
    }

    public static String rot13(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if (c >= 'a' && c <= 'z') sb.append((char) ('a' + (c - 'a' + 13) % 26));
            else if (c >= 'A' && c <= 'Z') sb.append((char) ('A' + (c - 'A' + 13) % 26));
            else sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Decodes one value. Returns empty for session markers such as
     * {@code UEME_CTLSESSION} and for records of unknown size.
     */
    public static Optional<Entry> decode(RegistryValue value) {
        String program = rot13(value.name());
        if (program.startsWith("UEME_CTL")) return Optional.empty();
        byte[] d = value.data();
        if (d.length == WIN7_SIZE) {
            return Optional.of(new Entry(program, LittleEndian.u32(d, 4),
                    WindowsTime.fromFiletime(LittleEndian.i64(d, 60)).orElse(null)));
        }
        if (d.length == XP_SIZE) {
            // XP starts counting at 5
            long count = Math.max(0, LittleEndian.u32(d, 4) - 5);
            return Optional.of(new Entry(program, count,
                    WindowsTime.fromFiletime(LittleEndian.i64(d, 8)).orElse(null)));
        }
        return Optional.empty();
    }
}
