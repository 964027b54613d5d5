package com.libragraph.triage.formats.filesystem;

/**
 * A byte range of the image that may hold a filesystem.
 */
public record Partition(long offset, long length, String description) {
}
