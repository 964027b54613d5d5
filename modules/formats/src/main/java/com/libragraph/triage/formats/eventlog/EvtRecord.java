package com.libragraph.triage.formats.eventlog;

import java.time.Instant;
import java.util.List;

/**
 * One record of a legacy event log.
 *
 * @param eventId   event code with the severity and facility bits masked off
 * @param eventType 1 error, 2 warning, 4 information, 8 audit success, 16 audit failure
 */
public record EvtRecord(long recordNumber, Instant generated, Instant written, int eventId, int eventType,
                        int category, String source, String computer, List<String> strings) {

    public String eventTypeName() {
        return switch (eventType) {
            case 0x01 -> "Error";
            case 0x02 -> "Warning";
            case 0x04 -> "Information";
            case 0x08 -> "Audit Success";
            case 0x10 -> "Audit Failure";
            default -> "Type " + eventType;
        };
    }
}
