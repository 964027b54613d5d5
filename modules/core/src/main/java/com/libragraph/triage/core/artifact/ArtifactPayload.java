package com.libragraph.triage.core.artifact;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * Type-specific body of an {@link Artifact}, stored as JSON with a {@code kind} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BrowserVisit.class, name = "browser_visit"),
        @JsonSubTypes.Type(value = BrowserDownload.class, name = "browser_download"),
        @JsonSubTypes.Type(value = BrowserCookie.class, name = "browser_cookie"),
        @JsonSubTypes.Type(value = UsbDevice.class, name = "usb_device"),
        @JsonSubTypes.Type(value = InstalledProgram.class, name = "installed_program"),
        @JsonSubTypes.Type(value = RunKey.class, name = "run_key"),
        @JsonSubTypes.Type(value = SystemSetting.class, name = "system_setting"),
        @JsonSubTypes.Type(value = DeletedFile.class, name = "deleted_file"),
        @JsonSubTypes.Type(value = EventLogEntry.class, name = "event_log"),
        @JsonSubTypes.Type(value = ExecutionCount.class, name = "execution_count"),
        @JsonSubTypes.Type(value = PrefetchRun.class, name = "prefetch"),
        @JsonSubTypes.Type(value = Shortcut.class, name = "shortcut"),
        @JsonSubTypes.Type(value = JumpList.class, name = "jump_list")
})
public sealed interface ArtifactPayload permits BrowserVisit, BrowserDownload, BrowserCookie, UsbDevice,
        InstalledProgram, RunKey, SystemSetting, DeletedFile, EventLogEntry, ExecutionCount, PrefetchRun,
        Shortcut, JumpList {

    /** User profile the record belongs to, null for machine-wide records. */
    default String profile() {
        return null;
    }

    /** Device or program the record is about; records sharing it are related. */
    default String identity() {
        return null;
    }

    /**
     * Combines this stored payload with a newer observation of the same
     * artifact. Empty when the newer observation adds nothing.
     */
    default Optional<ArtifactPayload> mergeWith(ArtifactPayload newer) {
        return Optional.empty();
    }
}
