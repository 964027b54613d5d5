package com.libragraph.triage.util.buffer;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * Heap buffer with a capacity fixed at allocation. Holds file content copied
 * out of an image when its size is known up front, or wraps bytes that were
 * already decoded (resident attributes) without copying them.
 */
public class RamBuffer extends Buffer {

    private final byte[] data;
    private int position;
    private int size;

    /** Empty buffer able to take exactly {@code capacity} bytes. */
    public RamBuffer(int capacity) {
        this.data = new byte[capacity];
    }

    /** Full buffer over {@code data}. The array is not copied. */
    public RamBuffer(byte[] data) {
        this.data = data;
        this.size = data.length;
    }

    @Override
    public long size() {
        return size;
    }

    public int capacity() {
        return data.length;
    }

    @Override
    public int read(ByteBuffer dst) {
        if (position >= size) {
            return -1;
        }
        int n = Math.min(size - position, dst.remaining());
        dst.put(data, position, n);
        position += n;
        return n;
    }

    @Override
    public void readFully(long pos, byte[] dst, int offset, int length) throws IOException {
        if (pos < 0 || pos + length > size) {
            throw new EOFException("Read of " + length + " bytes at " + pos + " exceeds size " + size);
        }
        System.arraycopy(data, (int) pos, dst, offset, length);
    }

    @Override
    public byte[] readAll() {
        return Arrays.copyOf(data, size);
    }

    /**
     * @throws IOException if the bytes do not fit in the remaining capacity
     */
    @Override
    public int write(ByteBuffer src) throws IOException {
        int n = src.remaining();
        if (n > data.length - position) {
            throw new IOException("Write of " + n + " bytes at " + position + " exceeds capacity " + data.length);
        }
        src.get(data, position, n);
        position += n;
        size = Math.max(size, position);
        return n;
    }

    /** Not supported: content is materialized once at its final size. */
    @Override
    public SeekableByteChannel truncate(long newSize) {
        throw new UnsupportedOperationException("RamBuffer has a fixed size");
    }

    @Override
    public long position() {
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) {
        if (newPosition < 0 || newPosition > data.length) {
            throw new IllegalArgumentException("Position " + newPosition + " outside capacity " + data.length);
        }
        this.position = (int) newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() {
    }
}
