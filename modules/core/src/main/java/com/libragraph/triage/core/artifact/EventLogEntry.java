package com.libragraph.triage.core.artifact;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A Windows event log record.
 *
 * @param log     log file name without extension, e.g. {@code SecEvent}
 * @param account user name taken from the record strings for logon events
 */
public record EventLogEntry(String log, long recordNumber, int eventId, String eventType, int category,
                            String source, String computer, Classification classification, String account,
                            Instant generated, List<String> strings) implements ArtifactPayload {

    public enum Classification { LOGON, SYSTEM, OTHER }

    static final Set<Integer> FAILED_LOGON = Set.of(529, 530, 531, 532, 533, 534, 535, 536, 537, 539, 4625);
    static final Set<Integer> EXPLICIT_LOGON = Set.of(552, 4648);
    static final Set<Integer> LOG_CLEARED = Set.of(517, 1102, 104);

    private static final Set<Integer> LOGON = Set.of(
            528, 529, 530, 531, 532, 533, 534, 535, 536, 537, 538, 539, 540,
            4624, 4625, 4634, 4647, 4648);
    private static final Set<Integer> SYSTEM = Set.of(
            6005, 6006, 6008, 6009, 6013, 1074, 1076, 7034, 7035, 7036, 7040);

    public EventLogEntry {
        strings = strings == null ? List.of() : List.copyOf(strings);
    }

    public static Classification classify(int eventId) {
        if (LOGON.contains(eventId)) return Classification.LOGON;
        if (SYSTEM.contains(eventId)) return Classification.SYSTEM;
        return Classification.OTHER;
    }

    public boolean failedLogon() {
        return FAILED_LOGON.contains(eventId);
    }

    public boolean explicitLogon() {
        return EXPLICIT_LOGON.contains(eventId);
    }

    public boolean logCleared() {
        return LOG_CLEARED.contains(eventId);
    }

    @Override
    public String profile() {
        return account;
    }
}
