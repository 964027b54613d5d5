package com.libragraph.triage.util.buffer;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Read-only BinaryData that stitches several files end to end into one
 * address space. Reads that cross a segment seam are served from both
 * segments; positional reads are safe to issue from several threads.
 */
public class SegmentedBinaryData extends BinaryData {

    private final List<Path> paths;
    private final FileChannel[] channels;
    /** starts[i] is the logical offset of segment i; starts[n] is the total size. */
    private final long[] starts;
    private long position;
    private boolean open = true;

    private SegmentedBinaryData(List<Path> paths, FileChannel[] channels, long[] starts) {
        this.paths = List.copyOf(paths);
        this.channels = channels;
        this.starts = starts;
    }

    /**
     * Opens all segments read-only, in the given order.
     */
    public static SegmentedBinaryData open(List<Path> segments) throws IOException {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("At least one segment is required");
        }
        List<FileChannel> opened = new ArrayList<>(segments.size());
        long[] starts = new long[segments.size() + 1];
        try {
            for (int i = 0; i < segments.size(); i++) {
                FileChannel ch = FileChannel.open(segments.get(i), StandardOpenOption.READ);
                opened.add(ch);
                starts[i + 1] = starts[i] + ch.size();
            }
        } catch (IOException e) {
            for (FileChannel ch : opened) {
                try {
                    ch.close();
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw e;
        }
        return new SegmentedBinaryData(segments, opened.toArray(new FileChannel[0]), starts);
    }

    public List<Path> segments() {
        return paths;
    }

    public int segmentCount() {
        return channels.length;
    }

    /** Logical offset at which the given segment begins. */
    public long segmentStart(int index) {
        return starts[index];
    }

    @Override
    public long size() {
        return starts[channels.length];
    }

    @Override
    public void readFully(long pos, byte[] dst, int offset, int length) throws IOException {
        if (pos < 0 || pos + length > size()) {
            throw new EOFException("Read of " + length + " bytes at " + pos + " exceeds size " + size());
        }
        long at = pos;
        int done = 0;
        while (done < length) {
            int seg = segmentOf(at);
            long inSeg = at - starts[seg];
            int chunk = (int) Math.min(length - done, starts[seg + 1] - at);
            ByteBuffer buf = ByteBuffer.wrap(dst, offset + done, chunk);
            long segPos = inSeg;
            while (buf.hasRemaining()) {
                int n = channels[seg].read(buf, segPos);
                if (n < 0) throw new EOFException("Segment " + paths.get(seg) + " shorter than expected");
                segPos += n;
            }
            done += chunk;
            at += chunk;
        }
    }

    @Override
    public synchronized int read(ByteBuffer dst) throws IOException {
        if (position >= size()) {
            return -1;
        }
        int toRead = (int) Math.min(dst.remaining(), size() - position);
        byte[] tmp = new byte[toRead];
        readFully(position, tmp, 0, toRead);
        dst.put(tmp);
        position += toRead;
        return toRead;
    }

    @Override
    public int write(ByteBuffer src) {
        throw new NonWritableChannelException();
    }

    @Override
    public synchronized long position() {
        return position;
    }

    @Override
    public synchronized SeekableByteChannel position(long newPosition) {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public SeekableByteChannel truncate(long size) {
        throw new NonWritableChannelException();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        if (!open) return;
        open = false;
        IOException first = null;
        for (FileChannel ch : channels) {
            try {
                ch.close();
            } catch (IOException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }

    private int segmentOf(long pos) {
        int idx = Arrays.binarySearch(starts, pos);
        if (idx >= 0) {
            // Skip zero-length segments that share a start offset
            while (idx < channels.length - 1 && starts[idx + 1] == pos) idx++;
            return Math.min(idx, channels.length - 1);
        }
        return -idx - 2;
    }
}
