package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.JumpList;
import com.libragraph.triage.core.artifact.PrefetchRun;
import com.libragraph.triage.core.artifact.Shortcut;
import com.libragraph.triage.formats.filesystem.FileEntry;
import com.libragraph.triage.formats.filesystem.SystemLocations;
import com.libragraph.triage.formats.filesystem.UserProfile;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.formats.prefetch.PrefetchFile;
import com.libragraph.triage.formats.shortcut.ShellLink;
import com.libragraph.triage.types.ArtifactType;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Prefetch files, shell links under each profile's Recent and Desktop
 * folders, and jump lists.
 */
@ApplicationScoped
public class FileSystemExtractor implements ArtifactExtractor {

    private static final Logger log = Logger.getLogger(FileSystemExtractor.class);

    static final List<String> SHORTCUT_DIRS = List.of(
            "AppData/Roaming/Microsoft/Windows/Recent", "Recent", "Desktop");
    static final String AUTOMATIC_DESTINATIONS = "AppData/Roaming/Microsoft/Windows/Recent/AutomaticDestinations";
    static final String CUSTOM_DESTINATIONS = "AppData/Roaming/Microsoft/Windows/Recent/CustomDestinations";

    private static final String AUTOMATIC_SUFFIX = ".automaticdestinations-ms";
    private static final String CUSTOM_SUFFIX = ".customdestinations-ms";

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.FILE_SYSTEM;
    }

    @Override
    public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
        return volumes.listVolumes().stream().map(Volume::index).flatMap(v -> Stream.of(
                prefetch(volumes, v, caseId, ctx),
                volumes.listUserProfiles(v).stream().flatMap(p -> shortcuts(volumes, p, caseId, ctx)),
                volumes.listUserProfiles(v).stream().flatMap(p -> jumpLists(volumes, p, caseId)))
                .flatMap(s -> s));
    }

    // Prefetch

    private Stream<Artifact> prefetch(VolumeSet volumes, int volume, String caseId, ExtractionContext ctx) {
        return Stream.of(SystemLocations.PREFETCH)
                .flatMap(dir -> ImageFiles.files(volumes, volume, dir, e -> hasSuffix(e, ".pf")).stream())
                .flatMap(f -> ImageFiles.guarded(ctx, "Prefetch " + f.path(), () -> {
                    byte[] data = ImageFiles.read(volumes, volume, f.path());
                    if (PrefetchFile.isCompressed(data)) {
                        log.debugf("Skipping compressed prefetch %s", f.path());
                        return Stream.empty();
                    }
                    return prefetchRuns(PrefetchFile.parse(data), ImageFiles.source(volume, f.path()), caseId)
                            .stream();
                }));
    }

    private List<Artifact> prefetchRuns(PrefetchFile pf, String source, String caseId) {
        String hash = String.format("%08X", pf.pathHash());
        List<Instant> runs = pf.runTimes().isEmpty() ? Collections.singletonList(null) : pf.runTimes();
        List<Artifact> out = new ArrayList<>();
        for (Instant run : runs) {
            PrefetchRun payload = new PrefetchRun(pf.executable(), pf.runCount(), run, pf.version(), hash);
            out.add(Artifact.of(caseId, ArtifactType.PREFETCH,
                    Artifact.key(ArtifactType.PREFETCH.name(), pf.executable(), run), run, source,
                    pf.executable() + " executed (run count " + pf.runCount() + ")", payload));
        }
        return out;
    }

    // Shortcuts

    private Stream<Artifact> shortcuts(VolumeSet volumes, UserProfile profile, String caseId,
                                       ExtractionContext ctx) {
        return SHORTCUT_DIRS.stream()
                .flatMap(dir -> ImageFiles.files(volumes, profile.volume(), profile.resolve(dir),
                        e -> hasSuffix(e, ".lnk")).stream())
                .flatMap(f -> ImageFiles.guarded(ctx, "Shortcut " + f.path(), () -> Stream.of(
                        shortcut(ShellLink.parse(ImageFiles.read(volumes, profile.volume(), f.path())),
                                f, profile, caseId))));
    }

    private Artifact shortcut(ShellLink link, FileEntry file, UserProfile profile, String caseId) {
        String target = link.targetPath() != null ? link.targetPath()
                : link.relativePath() != null ? link.relativePath() : file.path();
        Shortcut payload = new Shortcut(profile.name(), file.path(), target, link.targetCreated(),
                link.targetAccessed(), link.targetModified(), link.targetSize(), link.arguments(),
                link.workingDirectory(), link.volumeLabel());
        return Artifact.of(caseId, ArtifactType.SHORTCUT,
                Artifact.key(ArtifactType.SHORTCUT.name(), target, link.targetModified()), link.targetModified(),
                ImageFiles.source(profile.volume(), file.path()),
                "Shortcut to " + target + " (" + profile.name() + ")", payload);
    }

    // Jump lists

    private Stream<Artifact> jumpLists(VolumeSet volumes, UserProfile profile, String caseId) {
        return Stream.of(AUTOMATIC_DESTINATIONS, CUSTOM_DESTINATIONS)
                .flatMap(dir -> ImageFiles.files(volumes, profile.volume(), profile.resolve(dir),
                        e -> hasSuffix(e, AUTOMATIC_SUFFIX) || hasSuffix(e, CUSTOM_SUFFIX)).stream())
                .map(f -> jumpList(f, profile, caseId));
    }

    private Artifact jumpList(FileEntry file, UserProfile profile, String caseId) {
        String lower = file.name().toLowerCase(Locale.ROOT);
        String kind = lower.endsWith(AUTOMATIC_SUFFIX) ? "automatic" : "custom";
        String appId = file.name().substring(0, file.name().indexOf('.'));
        Instant modified = file.times().modified();
        JumpList payload = new JumpList(profile.name(), file.path(), appId, kind, file.size(), modified);
        return Artifact.of(caseId, ArtifactType.JUMP_LIST,
                Artifact.key(ArtifactType.JUMP_LIST.name(), file.path(), modified), modified,
                ImageFiles.source(profile.volume(), file.path()),
                "Jump list " + appId + " (" + kind + ", " + profile.name() + ")", payload);
    }

    private static boolean hasSuffix(FileEntry e, String suffix) {
        return e.name().toLowerCase(Locale.ROOT).endsWith(suffix);
    }
}
