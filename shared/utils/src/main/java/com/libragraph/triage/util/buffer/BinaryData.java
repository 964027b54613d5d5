package com.libragraph.triage.util.buffer;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only binary data backed by RAM, a temp file, or one or more image segments.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Provides convenience methods for positional reads, stream access and format detection.
 *
 * Design principles:
 * - Size is always available
 * - Positional reads never leave the channel position changed
 * - Stream access uses standard JDK wrappers (Channels.newInputStream)
 */
public abstract class BinaryData implements SeekableByteChannel {

    /** Largest content {@link #readAll()} will materialize. */
    public static final long MAX_IN_MEMORY = 512L * 1024 * 1024;

    /**
     * Wraps an existing SeekableByteChannel as BinaryData.
     */
    public static BinaryData wrap(SeekableByteChannel channel) {
        return new WrappedBinaryData(channel);
    }

    /**
     * Wraps a byte array as BinaryData without copying.
     */
    public static BinaryData of(byte[] data) {
        return new RamBuffer(data);
    }

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Reads exactly {@code length} bytes at {@code pos} into {@code dst}.
     * Subclasses with positional channels override this; the default
     * serializes on this instance and restores the channel position.
     *
     * @throws EOFException if the data ends before {@code length} bytes were read
     */
    public void readFully(long pos, byte[] dst, int offset, int length) throws IOException {
        synchronized (this) {
            long originalPos = position();
            try {
                position(pos);
                ByteBuffer buf = ByteBuffer.wrap(dst, offset, length);
                while (buf.hasRemaining()) {
                    if (read(buf) < 0) {
                        throw new EOFException("Unexpected end of data at " + (pos + buf.position() - offset));
                    }
                }
            } finally {
                position(originalPos);
            }
        }
    }

    /**
     * Convenience positional read returning a fresh array.
     */
    public byte[] read(long pos, int length) throws IOException {
        byte[] out = new byte[length];
        readFully(pos, out, 0, length);
        return out;
    }

    /**
     * Materializes the whole content. Bounded by {@link #MAX_IN_MEMORY}.
     */
    public byte[] readAll() {
        long size = size();
        if (size > MAX_IN_MEMORY) {
            throw new IllegalStateException("Content too large to load into memory: " + size + " bytes");
        }
        try {
            return read(0, (int) size);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read content", e);
        }
    }

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * Uses standard JDK Channels.newInputStream() wrapper.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return Channels.newInputStream(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }

    /**
     * Reads the first N bytes as a header (for format detection).
     * Does not advance the buffer position.
     *
     * Hard limit: min(maxBytes, 64KB) to prevent unbounded reads.
     *
     * @param maxBytes maximum bytes to read
     * @return header bytes (may be shorter than maxBytes if data is smaller)
     */
    public byte[] readHeader(int maxBytes) {
        int limit = Math.min(maxBytes, 64 * 1024);  // Hard 64KB limit
        int toRead = (int) Math.min(limit, size());
        try {
            return read(0, toRead);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read header", e);
        }
    }
}
