package com.libragraph.triage.util.buffer;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writable buffer that extends BinaryData with write capabilities.
 * Used to materialize file content read out of a disk image.
 *
 * Factory method allocates the appropriate backend (RAM or temp file)
 * based on size thresholds.
 */
public abstract class Buffer extends BinaryData {

    /** Threshold above which allocate() uses a temp file instead of RAM. */
    public static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    /**
     * Allocates a buffer of the given size.
     * Chooses backend automatically based on size:
     * <ul>
     *   <li>&lt; 4 MB: {@link RamBuffer} (heap byte array)</li>
     *   <li>&gt;= 4 MB: {@link FileBuffer} (temp-file backed {@link java.nio.channels.FileChannel})</li>
     * </ul>
     */
    public static Buffer allocate(long size) {
        if (size < FILE_THRESHOLD) {
            return new RamBuffer((int) size);
        }
        try {
            return new FileBuffer();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to allocate file-backed buffer", e);
        }
    }
}
