package com.libragraph.triage.util.buffer;

import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Buffer implementation backed by a temporary file.
 * Holds file content extracted from an image when it is too large for the heap.
 *
 * <p>The temp file is created on construction and deleted on {@link #close()}.
 * Its {@link #path()} can be handed to libraries that insist on a real file
 * (the SQLite driver, for instance).
 */
public class FileBuffer extends Buffer {

    private final Path path;
    private final FileChannel channel;
    private boolean open = true;

    public FileBuffer() throws IOException {
        this.path = Files.createTempFile("triage-buf-", ".tmp");
        this.channel = FileChannel.open(path,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
    }

    /** Location of the backing temp file. */
    public Path path() {
        return path;
    }

    @Override
    public long size() {
        try {
            return channel.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to get file size", e);
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        return channel.read(dst);
    }

    @Override
    public void readFully(long pos, byte[] dst, int offset, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(dst, offset, length);
        long at = pos;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, at);
            if (n < 0) throw new EOFException("Unexpected end of buffer at " + at);
            at += n;
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        return channel.write(src);
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        channel.truncate(newSize);
        if (channel.position() > newSize) {
            channel.position(newSize);
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        return channel.position();
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        channel.position(newPosition);
        return this;
    }

    @Override
    public boolean isOpen() {
        return open && channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        if (open) {
            open = false;
            channel.close();
            Files.deleteIfExists(path);
        }
    }
}
