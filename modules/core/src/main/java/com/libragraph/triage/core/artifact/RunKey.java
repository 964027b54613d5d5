package com.libragraph.triage.core.artifact;

/**
 * An autostart entry.
 *
 * @param hive    {@code SOFTWARE} or {@code NTUSER.DAT}
 * @param profile owning profile for per-user entries
 */
public record RunKey(String hive, String keyPath, String valueName, String command, String profile)
        implements ArtifactPayload {

    @Override
    public String identity() {
        return command;
    }
}
