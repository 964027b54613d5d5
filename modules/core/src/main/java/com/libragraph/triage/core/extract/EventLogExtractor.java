package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.EventLogEntry;
import com.libragraph.triage.formats.eventlog.EventLogFormat;
import com.libragraph.triage.formats.eventlog.EvtLog;
import com.libragraph.triage.formats.eventlog.EvtRecord;
import com.libragraph.triage.formats.filesystem.FileEntry;
import com.libragraph.triage.formats.filesystem.SystemLocations;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.types.ArtifactType;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Legacy {@code .evt} logs. {@code .evtx} files are recognised and skipped.
 */
@ApplicationScoped
public class EventLogExtractor implements ArtifactExtractor {

    private static final Logger log = Logger.getLogger(EventLogExtractor.class);

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.EVENT_LOG;
    }

    @Override
    public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
        return volumes.listVolumes().stream().map(Volume::index).flatMap(v -> SystemLocations.LOG_DIRECTORIES.stream()
                .flatMap(dir -> ImageFiles.files(volumes, v, dir, EventLogExtractor::isLogFile).stream())
                .flatMap(f -> ImageFiles.guarded(ctx, "Event log " + f.path(),
                        () -> decode(volumes, f, caseId, ctx).stream())));
    }

    static boolean isLogFile(FileEntry e) {
        String name = e.name().toLowerCase(Locale.ROOT);
        return name.endsWith(".evt") || name.endsWith(".evtx");
    }

    private List<Artifact> decode(VolumeSet volumes, FileEntry file, String caseId, ExtractionContext ctx) {
        EventLogFormat format = EventLogFormat.detect(ImageFiles.header(volumes, file.volume(), file.path(), 64));
        if (format == EventLogFormat.EVTX) {
            log.debugf("Skipping %s: EVTX binary XML is not decoded", file.path());
            return List.of();
        }
        if (format != EventLogFormat.EVT) {
            if (file.size() > 0) ctx.warn("Event log " + file.path() + ": unrecognised header");
            return List.of();
        }
        EvtLog parsed = EvtLog.parse(ImageFiles.read(volumes, file.volume(), file.path()));
        if (parsed.skippedRuns() > 0) {
            ctx.warn("Event log " + file.path() + ": skipped " + parsed.skippedRuns() + " unreadable region(s)");
        }
        String logName = baseName(file.name());
        String source = ImageFiles.source(file.volume(), file.path());
        return parsed.records().stream()
                .filter(r -> r.generated() != null)
                .map(r -> toArtifact(r, logName, source, caseId))
                .toList();
    }

    private Artifact toArtifact(EvtRecord r, String logName, String source, String caseId) {
        EventLogEntry.Classification classification = EventLogEntry.classify(r.eventId());
        String account = classification == EventLogEntry.Classification.LOGON ? accountOf(r) : null;
        EventLogEntry entry = new EventLogEntry(logName, r.recordNumber(), r.eventId(), r.eventTypeName(),
                r.category(), r.source(), r.computer(), classification, account, r.generated(), r.strings());
        String who = account != null ? " account " + account : "";
        String description = "Event " + r.eventId() + " from " + r.source() + " (" + r.eventTypeName() + ")"
                + who + " on " + r.computer();
        return Artifact.of(caseId, ArtifactType.EVENT_LOG,
                Artifact.key(r.eventId(), r.generated(), r.source(), logName + ":" + r.recordNumber()),
                r.generated(), source, description, entry);
    }

    /** User name position in the insertion strings of the logon events. */
    static String accountOf(EvtRecord r) {
        int index = switch (r.eventId()) {
            case 4624, 4625, 4648 -> 5;
            case 4634, 4647 -> 1;
            default -> 0;
        };
        if (index >= r.strings().size()) return null;
        String account = r.strings().get(index);
        return account == null || account.isBlank() || account.equals("-") ? null : account;
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
