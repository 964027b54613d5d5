package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.DeletedFile;
import com.libragraph.triage.formats.filesystem.DeletedEntry;
import com.libragraph.triage.formats.filesystem.FileEntry;
import com.libragraph.triage.formats.filesystem.SystemLocations;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.formats.recycle.RecycleBinRecords;
import com.libragraph.triage.formats.recycle.RecycledFile;
import com.libragraph.triage.types.ArtifactType;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Deleted files from recycle-bin metadata ({@code $I} and {@code INFO2}) and
 * from MFT records that are no longer in use. The bin's metadata alone is
 * enough to report a deletion; whether the content survives is recorded
 * alongside.
 */
@ApplicationScoped
public class RecycleBinExtractor implements ArtifactExtractor {

    static final String INFO2 = "INFO2";

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.RECYCLE_BIN;
    }

    @Override
    public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
        return volumes.listVolumes().stream().map(Volume::index).flatMap(v -> Stream.concat(
                Stream.of(v).flatMap(vol -> binFolders(volumes, vol).stream())
                        .flatMap(folder -> folder(volumes, v, folder, caseId, ctx)),
                freedRecords(volumes, v, caseId)));
    }

    /** Each bin root plus its per-user (SID) folders, once each. */
    private List<FileEntry> binFolders(VolumeSet volumes, int volume) {
        Map<Long, FileEntry> folders = new LinkedHashMap<>();
        for (String bin : SystemLocations.RECYCLE_BINS) {
            volumes.stat(volume, bin).filter(FileEntry::directory).ifPresent(root -> {
                folders.putIfAbsent(root.recordNumber(), root);
                for (FileEntry e : ImageFiles.list(volumes, volume, root.path())) {
                    if (e.directory()) folders.putIfAbsent(e.recordNumber(), e);
                }
            });
        }
        return new ArrayList<>(folders.values());
    }

    private Stream<Artifact> folder(VolumeSet volumes, int volume, FileEntry folder, String caseId,
                                    ExtractionContext ctx) {
        List<FileEntry> entries = ImageFiles.list(volumes, volume, folder.path());
        String profile = folder.name().toUpperCase(Locale.ROOT).startsWith("S-") ? folder.name() : null;
        return entries.stream()
                .filter(e -> !e.directory())
                .flatMap(e -> {
                    String name = e.name();
                    if (name.equalsIgnoreCase(INFO2)) {
                        return ImageFiles.guarded(ctx, "INFO2 " + e.path(), () -> RecycleBinRecords
                                .parseInfo2(ImageFiles.read(volumes, volume, e.path())).stream()
                                .map(r -> toArtifact(r, entries, volume, e.path(), profile, caseId)));
                    }
                    if (name.length() > 2 && name.regionMatches(true, 0, "$I", 0, 2)) {
                        return ImageFiles.guarded(ctx, "Recycle bin index " + e.path(), () -> Stream.of(
                                toArtifact(RecycleBinRecords.parseIndexFile(name,
                                        ImageFiles.read(volumes, volume, e.path())),
                                        entries, volume, e.path(), profile, caseId)));
                    }
                    return Stream.empty();
                });
    }

    private Artifact toArtifact(RecycledFile r, List<FileEntry> siblings, int volume, String indexPath,
                                String profile, String caseId) {
        boolean recoverable = siblings.stream().anyMatch(s -> s.name().equalsIgnoreCase(r.recycledName()));
        DeletedFile deleted = new DeletedFile(r.originalPath(), r.size(), r.deletedAt(),
                DeletedFile.SOURCE_RECYCLE_BIN, recoverable, r.recycledName(), profile);
        return Artifact.of(caseId, ArtifactType.DELETED_FILE, Artifact.key(r.originalPath(), r.deletedAt()),
                r.deletedAt(), ImageFiles.source(volume, indexPath),
                "Deleted " + r.originalPath() + " (" + r.size() + " bytes" + (recoverable ? ", content in bin)" : ")"),
                deleted);
    }

    private Stream<Artifact> freedRecords(VolumeSet volumes, int volume, String caseId) {
        return Stream.of(volume).flatMap(v -> volumes.enumerateDeleted(v))
                .filter(e -> !e.directory())
                .map(e -> fromMft(e, caseId));
    }

    private Artifact fromMft(DeletedEntry e, String caseId) {
        // the record's MFT-change time is the closest thing to a deletion time it carries
        Instant deletedAt = e.times().changed();
        DeletedFile deleted = new DeletedFile(e.path(), e.size(), deletedAt, DeletedFile.SOURCE_MFT,
                e.recoverable(), null, null);
        return Artifact.of(caseId, ArtifactType.DELETED_FILE, Artifact.key(e.path(), deletedAt), deletedAt,
                ImageFiles.source(e.volume(), "$MFT#" + e.recordNumber()),
                "Deleted " + e.path() + " (MFT record " + e.recordNumber()
                        + (e.recoverable() ? ", content recoverable)" : ")"),
                deleted);
    }
}
