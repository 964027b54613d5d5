package com.libragraph.triage.formats.filesystem;

/**
 * A live file or directory.
 *
 * @param path         absolute path within the volume using {@code /} separators
 * @param recordNumber MFT record number
 */
public record FileEntry(int volume, String path, String name, boolean directory, long size,
                        MacbTimes times, long recordNumber) {
}
