package com.libragraph.triage.formats.filesystem;

/**
 * A file record still present in filesystem metadata although no longer in use.
 *
 * @param parentPath  best-effort path of the former parent directory,
 *                    {@code /$OrphanFiles} when the parent is unknown
 * @param recoverable whether content is still addressable (resident data or non-sparse runs)
 */
public record DeletedEntry(int volume, long recordNumber, String name, String parentPath, boolean directory,
                           long size, MacbTimes times, boolean recoverable) {

    public String path() {
        return parentPath.endsWith("/") ? parentPath + name : parentPath + "/" + name;
    }
}
