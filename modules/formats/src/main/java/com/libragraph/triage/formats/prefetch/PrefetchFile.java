package com.libragraph.triage.formats.prefetch;

import com.libragraph.triage.formats.error.CorruptStructureException;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.WindowsTime;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Uncompressed Windows prefetch file ({@code SCCA}).
 *
 * <table>
 *   <caption>Per-version offsets</caption>
 *   <tr><th>Version</th><th>Last run</th><th>Run count</th></tr>
 *   <tr><td>17 (XP)</td><td>0x78</td><td>0x90</td></tr>
 *   <tr><td>23 (Vista/7)</td><td>0x80</td><td>0x98</td></tr>
 *   <tr><td>26 (8.1), 30 (10)</td><td>0x80, eight slots</td><td>0xD0</td></tr>
 * </table>
 *
 * @param runTimes most recent first, unset slots omitted
 */
public record PrefetchFile(int version, String executable, long pathHash, long runCount, List<Instant> runTimes) {

    private static final byte[] SCCA = "SCCA".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] MAM = {'M', 'A', 'M', 0x04};

    /** Windows 10 stores prefetch files Xpress-Huffman compressed behind a {@code MAM} header. */
    public static boolean isCompressed(byte[] header) {
        return LittleEndian.startsWith(header, 0, MAM);
    }

    /**
     * @throws CorruptStructureException on a missing signature or unsupported version
     */
    public static PrefetchFile parse(byte[] d) {
        if (!LittleEndian.startsWith(d, 4, SCCA)) {
            throw new CorruptStructureException("prefetch", "missing SCCA signature");
        }
        int version = (int) LittleEndian.u32(d, 0);
        try {
            String name = LittleEndian.utf16(d, 16, 60);
            long hash = LittleEndian.u32(d, 0x4C);
            return switch (version) {
                case 17 -> new PrefetchFile(version, name, hash, LittleEndian.u32(d, 0x90), times(d, 0x78, 1));
                case 23 -> new PrefetchFile(version, name, hash, LittleEndian.u32(d, 0x98), times(d, 0x80, 1));
                case 26, 30 -> new PrefetchFile(version, name, hash, LittleEndian.u32(d, 0xD0), times(d, 0x80, 8));
                default -> throw new CorruptStructureException("prefetch", "unsupported version " + version);
            };
        } catch (IndexOutOfBoundsException e) {
            throw new CorruptStructureException("prefetch", "truncated version " + version + " file", e);
        }
    }

    private static List<Instant> times(byte[] d, int off, int slots) {
        List<Instant> out = new ArrayList<>();
        for (int i = 0; i < slots; i++) {
            WindowsTime.fromFiletime(LittleEndian.i64(d, off + i * 8)).ifPresent(out::add);
        }
        return List.copyOf(out);
    }

    public Optional<Instant> lastRun() {
        return runTimes.isEmpty() ? Optional.empty() : Optional.of(runTimes.get(0));
    }
}
