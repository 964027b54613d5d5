package com.libragraph.triage.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Conversions between the epochs found in Windows and browser artifacts and {@link Instant}.
 * Zero and out-of-range values decode to empty: artifacts use them for "never".
 */
public final class WindowsTime {

    /** 100ns intervals between 1601-01-01 and 1970-01-01. */
    public static final long FILETIME_EPOCH_OFFSET = 116_444_736_000_000_000L;

    /** Microseconds between 1601-01-01 and 1970-01-01 (WebKit/Chrome timestamps). */
    public static final long WEBKIT_EPOCH_OFFSET_MICROS = 11_644_473_600_000_000L;

    private static final Instant LOWER = Instant.parse("1980-01-01T00:00:00Z");
    private static final Instant UPPER = Instant.parse("2200-01-01T00:00:00Z");
    private static final DateTimeFormatter INSTALL_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private WindowsTime() {
    }

    /** FILETIME: 100ns intervals since 1601-01-01 UTC. */
    public static Optional<Instant> fromFiletime(long filetime) {
        if (filetime <= 0) return Optional.empty();
        long sinceUnix = filetime - FILETIME_EPOCH_OFFSET;
        long seconds = Math.floorDiv(sinceUnix, 10_000_000L);
        long nanos = Math.floorMod(sinceUnix, 10_000_000L) * 100;
        return plausible(Instant.ofEpochSecond(seconds, nanos));
    }

    public static long toFiletime(Instant instant) {
        return instant.getEpochSecond() * 10_000_000L + instant.getNano() / 100 + FILETIME_EPOCH_OFFSET;
    }

    /** WebKit time: microseconds since 1601-01-01 UTC (Chrome, Edge). */
    public static Optional<Instant> fromWebkit(long micros) {
        if (micros <= 0) return Optional.empty();
        return fromUnixMicros(micros - WEBKIT_EPOCH_OFFSET_MICROS);
    }

    public static long toWebkit(Instant instant) {
        return toUnixMicros(instant) + WEBKIT_EPOCH_OFFSET_MICROS;
    }

    /** PRTime: microseconds since 1970-01-01 UTC (Firefox). */
    public static Optional<Instant> fromUnixMicros(long micros) {
        if (micros <= 0) return Optional.empty();
        return plausible(Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L),
                Math.floorMod(micros, 1_000_000L) * 1000));
    }

    public static long toUnixMicros(Instant instant) {
        return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1000;
    }

    public static Optional<Instant> fromUnixSeconds(long seconds) {
        if (seconds <= 0) return Optional.empty();
        return plausible(Instant.ofEpochSecond(seconds));
    }

    /** Registry {@code InstallDate} strings of the form {@code yyyyMMdd}. */
    public static Optional<Instant> fromInstallDate(String value) {
        if (value == null || value.length() != 8) return Optional.empty();
        try {
            return plausible(LocalDate.parse(value, INSTALL_DATE).atStartOfDay().toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> plausible(Instant t) {
        return t.isBefore(LOWER) || t.isAfter(UPPER) ? Optional.empty() : Optional.of(t);
    }
}
