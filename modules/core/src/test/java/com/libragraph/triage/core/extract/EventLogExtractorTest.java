package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.EventLogEntry;
import com.libragraph.triage.testing.EvtLogBuilder;
import com.libragraph.triage.testing.NtfsImageBuilder;
import com.libragraph.triage.types.ArtifactType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EventLogExtractorTest {

    private static final Instant T0 = Instant.parse("2009-02-10T22:15:00Z");
    private static final String CONFIG = "/Windows/System32/config/";

    @TempDir
    Path tempDir;

    private final EventLogExtractor extractor = new EventLogExtractor();

    private static byte[] securityLog() {
        return new EvtLogBuilder()
                .computer("XP-BOX")
                .event(4625, 16, T0, "Microsoft-Windows-Security-Auditing",
                        "S-1-0-0", "-", "-", "0x0", "S-1-0-0", "mallory", "XP-BOX")
                .event(4624, 8, T0.plusSeconds(30), "Microsoft-Windows-Security-Auditing",
                        "S-1-5-18", "XP-BOX$", "WORKGROUP", "0x3e7", "S-1-5-21-1", "alice")
                .build();
    }

    @Test
    void evtRecordsShouldBecomeClassifiedEvents() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file(CONFIG + "SecEvent.Evt", securityLog())
                .file(CONFIG + "SysEvent.Evt", new EvtLogBuilder()
                        .computer("XP-BOX")
                        .event(7036, 4, T0.plusSeconds(90), "Service Control Manager", "Spooler", "running")
                        .build());

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            List<Artifact> events = mounted.run(extractor);

            assertThat(events).hasSize(3).allSatisfy(a -> assertThat(a.type()).isEqualTo(ArtifactType.EVENT_LOG));
            assertThat(events).filteredOn(a -> ((EventLogEntry) a.payload()).eventId() == 4625).singleElement()
                    .satisfies(a -> {
                        EventLogEntry e = (EventLogEntry) a.payload();
                        assertThat(e.failedLogon()).isTrue();
                        assertThat(e.classification()).isEqualTo(EventLogEntry.Classification.LOGON);
                        assertThat(e.account()).isEqualTo("mallory");
                        assertThat(e.log()).isEqualTo("SecEvent");
                        assertThat(e.computer()).isEqualTo("XP-BOX");
                        assertThat(a.timestamp()).isEqualTo(T0);
                        assertThat(a.sourcePath()).isEqualTo("vol0:" + CONFIG + "SecEvent.Evt");
                        assertThat(a.description()).contains("account mallory");
                    });
            assertThat(events).filteredOn(a -> ((EventLogEntry) a.payload()).eventId() == 7036).singleElement()
                    .satisfies(a -> {
                        EventLogEntry e = (EventLogEntry) a.payload();
                        assertThat(e.classification()).isEqualTo(EventLogEntry.Classification.SYSTEM);
                        assertThat(e.account()).isNull();
                    });
        }
    }

    @Test
    void evtxShouldBeSkippedWithoutWarning() throws Exception {
        byte[] evtx = new byte[4096];
        System.arraycopy("ElfFile\0".getBytes(StandardCharsets.US_ASCII), 0, evtx, 0, 8);
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file("/Windows/System32/winevt/Logs/Security.evtx", evtx)
                .file(CONFIG + "SecEvent.Evt", securityLog());

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            ExtractionContext ctx = ExtractionContext.standalone(MountedImage.CASE, extractor.kind());

            assertThat(mounted.run(extractor, ctx)).hasSize(2);
            assertThat(ctx.warnings()).isEmpty();
        }
    }

    @Test
    void damagedRegionsShouldBeReportedAndSkipped() throws Exception {
        NtfsImageBuilder b = new NtfsImageBuilder()
                .file(CONFIG + "AppEvent.Evt", new EvtLogBuilder()
                        .event(1000, 1, T0, "Application Error")
                        .garbage(37)
                        .event(1001, 4, T0.plusSeconds(5), "Windows Error Reporting")
                        .build())
                .file(CONFIG + "Broken.evt", "not an event log".getBytes(StandardCharsets.US_ASCII));

        try (MountedImage mounted = MountedImage.of(tempDir, b)) {
            ExtractionContext ctx = ExtractionContext.standalone(MountedImage.CASE, extractor.kind());

            List<Artifact> events = mounted.run(extractor, ctx);

            assertThat(events).extracting(a -> ((EventLogEntry) a.payload()).eventId()).containsExactlyInAnyOrder(1000, 1001);
            assertThat(ctx.warnings()).containsExactlyInAnyOrder(
                    "Event log " + CONFIG + "AppEvent.Evt: skipped 1 unreadable region(s)",
                    "Event log " + CONFIG + "Broken.evt: unrecognised header");
        }
    }
}
