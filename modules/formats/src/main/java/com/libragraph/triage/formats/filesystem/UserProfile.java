package com.libragraph.triage.formats.filesystem;

/**
 * A user profile root such as {@code /Users/alice}.
 */
public record UserProfile(int volume, String name, String path) {

    /** Resolves a profile-relative path, e.g. {@code NTUSER.DAT}. */
    public String resolve(String relative) {
        String rel = relative.replace('\\', '/');
        while (rel.startsWith("/")) rel = rel.substring(1);
        return rel.isEmpty() ? path : path + "/" + rel;
    }
}
