package com.libragraph.triage.core.extract;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.ExecutionCount;
import com.libragraph.triage.formats.filesystem.SystemLocations;
import com.libragraph.triage.formats.filesystem.UserProfile;
import com.libragraph.triage.formats.filesystem.Volume;
import com.libragraph.triage.formats.filesystem.VolumeSet;
import com.libragraph.triage.formats.registry.RegistryHive;
import com.libragraph.triage.formats.registry.RegistryKey;
import com.libragraph.triage.formats.registry.RegistryValue;
import com.libragraph.triage.formats.registry.UserAssist;
import com.libragraph.triage.types.ArtifactType;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Per-user program execution counters (UserAssist).
 */
@ApplicationScoped
public class UserActivityExtractor implements ArtifactExtractor {

    static final String USER_ASSIST = "Software\\Microsoft\\Windows\\CurrentVersion\\Explorer\\UserAssist";

    @Override
    public ExtractorKind kind() {
        return ExtractorKind.USER_ACTIVITY;
    }

    @Override
    public Stream<Artifact> extract(VolumeSet volumes, String caseId, ExtractionContext ctx) {
        return volumes.listVolumes().stream().map(Volume::index)
                .flatMap(v -> volumes.listUserProfiles(v).stream())
                .flatMap(p -> {
                    String hivePath = p.resolve(SystemLocations.NTUSER);
                    return ImageFiles.guarded(ctx, "Registry hive " + hivePath, () -> {
                        if (!volumes.exists(p.volume(), hivePath)) return Stream.empty();
                        RegistryHive hive = RegistryHive.parse(ImageFiles.read(volumes, p.volume(), hivePath));
                        return counters(hive, p, hivePath, caseId).stream();
                    });
                });
    }

    private List<Artifact> counters(RegistryHive hive, UserProfile profile, String hivePath, String caseId) {
        List<Artifact> out = new ArrayList<>();
        Optional<RegistryKey> root = hive.key(USER_ASSIST);
        if (root.isEmpty()) return out;
        String source = ImageFiles.source(profile.volume(), hivePath);
        for (RegistryKey guid : root.get().subkeys()) {
            Optional<RegistryKey> count = guid.subkey("Count");
            if (count.isEmpty()) continue;
            for (RegistryValue value : count.get().values()) {
                UserAssist.decode(value).ifPresent(entry -> {
                    ExecutionCount exec = new ExecutionCount(profile.name(), entry.program(), entry.runCount(),
                            entry.lastRun());
                    out.add(Artifact.of(caseId, ArtifactType.EXECUTION_COUNT,
                            Artifact.key(entry.program(), profile.name()), entry.lastRun(), source,
                            profile.name() + " ran " + entry.program() + " " + entry.runCount() + " time(s)",
                            exec));
                });
            }
        }
        return out;
    }
}
