package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.EventLogEntry;
import com.libragraph.triage.core.artifact.UsbDevice;
import com.libragraph.triage.types.ArtifactType;

import java.time.Instant;
import java.util.List;

/** Artifact factories for the anomaly tests. */
final class Activities {

    static final String SECURITY_LOG = "vol0:/Windows/System32/config/SecEvent.Evt";
    static final String SYSTEM_LOG = "vol0:/Windows/System32/config/SysEvent.Evt";

    private Activities() {
    }

    static Artifact serviceEvent(String caseId, int record, Instant at) {
        EventLogEntry e = new EventLogEntry("SysEvent", record, 7036, "Information", 0, "Service Control Manager",
                "WS01", EventLogEntry.Classification.SYSTEM, null, at, List.of("Spooler", "running"));
        return Artifact.of(caseId, ArtifactType.EVENT_LOG, Artifact.key(7036, at, "Service Control Manager",
                "SysEvent:" + record), at, SYSTEM_LOG, "Event 7036 from Service Control Manager", e);
    }

    static Artifact failedLogon(String caseId, int record, Instant at, String account) {
        EventLogEntry e = new EventLogEntry("SecEvent", record, 4625, "Audit Failure", 0,
                "Microsoft-Windows-Security-Auditing", "WS01", EventLogEntry.Classification.LOGON, account, at,
                List.of("S-1-0-0", "-", "-", "0x0", "S-1-0-0", account));
        return Artifact.of(caseId, ArtifactType.EVENT_LOG, Artifact.key(4625, at, "Security", "SecEvent:" + record),
                at, SECURITY_LOG, "Event 4625 account " + account, e);
    }

    static Artifact usb(String caseId, String serial, Instant at) {
        return Artifact.of(caseId, ArtifactType.USB_DEVICE, serial, at, "vol0:/Windows/System32/config/SYSTEM",
                "USB device " + serial, new UsbDevice(serial, "USBSTOR", null, null, null, null, at, at));
    }
}
