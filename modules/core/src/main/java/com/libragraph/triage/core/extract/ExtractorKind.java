package com.libragraph.triage.core.extract;

import com.libragraph.triage.types.ArtifactType;

import java.util.EnumSet;
import java.util.Set;

/**
 * The fixed set of extractors, with the artifact types each one produces.
 */
public enum ExtractorKind {
    BROWSER("browser", EnumSet.of(ArtifactType.BROWSER_HISTORY, ArtifactType.BROWSER_DOWNLOAD,
            ArtifactType.BROWSER_COOKIE)),
    REGISTRY("registry", EnumSet.of(ArtifactType.USB_DEVICE, ArtifactType.INSTALLED_PROGRAM,
            ArtifactType.RUN_KEY, ArtifactType.SYSTEM_SETTING)),
    RECYCLE_BIN("recycle_bin", EnumSet.of(ArtifactType.DELETED_FILE)),
    EVENT_LOG("event_log", EnumSet.of(ArtifactType.EVENT_LOG)),
    USER_ACTIVITY("user_activity", EnumSet.of(ArtifactType.EXECUTION_COUNT)),
    FILE_SYSTEM("file_system", EnumSet.of(ArtifactType.PREFETCH, ArtifactType.SHORTCUT, ArtifactType.JUMP_LIST));

    private final String label;
    private final Set<ArtifactType> produces;

    ExtractorKind(String label, Set<ArtifactType> produces) {
        this.label = label;
        this.produces = produces;
    }

    public String label() {
        return label;
    }

    public Set<ArtifactType> produces() {
        return EnumSet.copyOf(produces);
    }

    public static ExtractorKind forType(ArtifactType type) {
        for (ExtractorKind kind : values()) {
            if (kind.produces.contains(type)) return kind;
        }
        throw new IllegalArgumentException("No extractor produces " + type);
    }
}
