package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.error.ImageFormatException;
import com.libragraph.triage.util.LittleEndian;
import com.libragraph.triage.util.buffer.BinaryData;
import org.jboss.logging.Logger;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.Adler32;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Media data of an EWF-E01 container, decoded chunk by chunk.
 *
 * <p>Each segment file starts with a 13-byte header followed by a chain of
 * 76-byte section descriptors. The {@code volume} (or {@code disk}) section
 * carries the geometry; each {@code table} section lists chunk offsets
 * (bit 31 marks zlib compression) relative to its base offset. A chunk ends
 * where the next one starts, or, for the last chunk of a table, where the
 * section surrounding it ends.
 */
final class EwfImage extends BinaryData {

    private static final Logger log = Logger.getLogger(EwfImage.class);

    static final int FILE_HEADER_SIZE = 13;
    static final int SECTION_DESCRIPTOR_SIZE = 76;
    static final int TABLE_HEADER_SIZE = 24;
    private static final int CACHE_CHUNKS = 16;

    private record Chunk(int segment, long offset, int storedLength, boolean compressed) {}

    private record Section(String type, long start, long end) {}

    private final List<Path> segmentPaths;
    private final FileChannel[] channels;
    private final List<Chunk> chunks;
    private final int chunkSize;
    private final int bytesPerSector;
    private final long sectorCount;
    private final long size;
    private final Map<Integer, byte[]> cache = new LinkedHashMap<>(CACHE_CHUNKS, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Integer, byte[]> eldest) {
            return size() > CACHE_CHUNKS;
        }
    };
    private long position;
    private boolean open = true;

    private EwfImage(List<Path> segmentPaths, FileChannel[] channels, List<Chunk> chunks,
                     int chunkSize, int bytesPerSector, long sectorCount) {
        this.segmentPaths = segmentPaths;
        this.channels = channels;
        this.chunks = chunks;
        this.chunkSize = chunkSize;
        this.bytesPerSector = bytesPerSector;
        this.sectorCount = sectorCount;
        this.size = sectorCount * bytesPerSector;
    }

    static EwfImage open(List<Path> segments) throws IOException {
        FileChannel[] channels = new FileChannel[segments.size()];
        try {
            for (int i = 0; i < segments.size(); i++) {
                channels[i] = FileChannel.open(segments.get(i), StandardOpenOption.READ);
            }
            return parse(segments, channels);
        } catch (IOException | RuntimeException e) {
            for (FileChannel ch : channels) {
                if (ch != null) {
                    try {
                        ch.close();
                    } catch (IOException suppressed) {
                        e.addSuppressed(suppressed);
                    }
                }
            }
            throw e;
        }
    }

    private static EwfImage parse(List<Path> segments, FileChannel[] channels) throws IOException {
        int sectorsPerChunk = 0;
        int bytesPerSector = 0;
        long sectorCount = -1;
        List<Chunk> chunks = new ArrayList<>();

        for (int seg = 0; seg < channels.length; seg++) {
            Path path = segments.get(seg);
            FileChannel ch = channels[seg];
            long fileSize = ch.size();
            byte[] fileHeader = readAt(ch, 0, FILE_HEADER_SIZE, path);
            if (!LittleEndian.startsWith(fileHeader, 0, EwfImageFactory.EVF_SIGNATURE)) {
                throw new ImageFormatException(path, "Missing EWF signature in segment");
            }
            int segmentNumber = LittleEndian.u16(fileHeader, 9);
            if (segmentNumber != seg + 1) {
                throw new ImageFormatException(path, "Expected segment " + (seg + 1) + " but found " + segmentNumber);
            }

            List<Section> sections = new ArrayList<>();
            long off = FILE_HEADER_SIZE;
            boolean last = false;
            while (true) {
                if (off + SECTION_DESCRIPTOR_SIZE > fileSize) {
                    throw new ImageFormatException(path, "Section chain runs past end of segment at " + off);
                }
                byte[] desc = readAt(ch, off, SECTION_DESCRIPTOR_SIZE, path);
                verifyDescriptor(desc, path, off);
                String type = LittleEndian.ascii(desc, 0, 16);
                long next = LittleEndian.i64(desc, 16);
                long sectionSize = LittleEndian.i64(desc, 24);
                long end = sectionSize > 0 ? off + sectionSize : next;
                sections.add(new Section(type, off, end));
                long dataStart = off + SECTION_DESCRIPTOR_SIZE;

                switch (type) {
                    case "volume", "disk" -> {
                        byte[] vol = readAt(ch, dataStart, 24, path);
                        sectorsPerChunk = (int) LittleEndian.u32(vol, 8);
                        bytesPerSector = (int) LittleEndian.u32(vol, 12);
                        sectorCount = LittleEndian.i64(vol, 16);
                    }
                    case "table" -> readTable(ch, path, seg, dataStart, chunks);
                    case "done" -> last = true;
                    default -> {
                        // header, header2, sectors, table2, hash, digest, data: not needed for media reads
                    }
                }
                if (type.equals("next") || type.equals("done") || next == off) break;
                if (next <= off || next > fileSize) {
                    throw new ImageFormatException(path, "Invalid next-section offset " + next + " at " + off);
                }
                off = next;
            }
            resolveLastChunkEnd(chunks, seg, sections, path);
            if (last && seg != channels.length - 1) {
                log.warnf("EWF segment %s is marked done but %d more segment(s) follow; ignoring them",
                        path, channels.length - 1 - seg);
                break;
            }
        }

        Path first = segments.get(0);
        if (sectorCount < 0 || sectorsPerChunk <= 0 || bytesPerSector <= 0) {
            throw new ImageFormatException(first, "EWF volume section missing or invalid");
        }
        long chunkSizeLong = (long) sectorsPerChunk * bytesPerSector;
        if (chunkSizeLong > 64L * 1024 * 1024) {
            throw new ImageFormatException(first, "Unsupported EWF chunk size " + chunkSizeLong);
        }
        int chunkSize = (int) chunkSizeLong;
        long mediaSize = sectorCount * bytesPerSector;
        long needed = (mediaSize + chunkSize - 1) / chunkSize;
        if (chunks.size() < needed) {
            throw new ImageFormatException(first, "EWF container holds " + chunks.size()
                    + " chunk(s) but media needs " + needed);
        }
        return new EwfImage(List.copyOf(segments), channels, chunks, chunkSize, bytesPerSector, sectorCount);
    }

    private static void verifyDescriptor(byte[] desc, Path path, long off) {
        Adler32 adler = new Adler32();
        adler.update(desc, 0, 72);
        if (adler.getValue() != LittleEndian.u32(desc, 72)) {
            throw new ImageFormatException(path, "Section descriptor checksum mismatch at " + off);
        }
    }

    private static void readTable(FileChannel ch, Path path, int seg, long dataStart,
                                  List<Chunk> chunks) throws IOException {
        byte[] header = readAt(ch, dataStart, TABLE_HEADER_SIZE, path);
        long entryCount = LittleEndian.u32(header, 0);
        long base = LittleEndian.i64(header, 8);
        if (entryCount > 16_777_216L) {
            throw new ImageFormatException(path, "Implausible EWF table entry count " + entryCount);
        }
        byte[] entries = readAt(ch, dataStart + TABLE_HEADER_SIZE, (int) entryCount * 4, path);
        long[] offsets = new long[(int) entryCount];
        boolean[] compressed = new boolean[(int) entryCount];
        for (int i = 0; i < entryCount; i++) {
            long raw = LittleEndian.u32(entries, i * 4);
            compressed[i] = (raw & 0x80000000L) != 0;
            offsets[i] = base + (raw & 0x7FFFFFFFL);
        }
        for (int i = 0; i < entryCount; i++) {
            // Last entry's length is fixed up once the enclosing section is known
            int len = i + 1 < entryCount ? (int) (offsets[i + 1] - offsets[i]) : -1;
            if (i + 1 < entryCount && len <= 0) {
                throw new ImageFormatException(path, "EWF chunk offsets are not increasing at entry " + i);
            }
            chunks.add(new Chunk(seg, offsets[i], len, compressed[i]));
        }
    }

    private static void resolveLastChunkEnd(List<Chunk> chunks, int seg, List<Section> sections, Path path) {
        for (int i = 0; i < chunks.size(); i++) {
            Chunk c = chunks.get(i);
            if (c.segment() != seg || c.storedLength() >= 0) continue;
            long end = -1;
            for (Section s : sections) {
                if (s.start() < c.offset() && s.end() > c.offset()) {
                    end = s.end();
                    break;
                }
            }
            if (end < 0) {
                throw new ImageFormatException(path, "No section surrounds EWF chunk at " + c.offset());
            }
            chunks.set(i, new Chunk(seg, c.offset(), (int) (end - c.offset()), c.compressed()));
        }
    }

    private static byte[] readAt(FileChannel ch, long pos, int len, Path path) throws IOException {
        byte[] out = new byte[len];
        ByteBuffer buf = ByteBuffer.wrap(out);
        long at = pos;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, at);
            if (n < 0) throw new ImageFormatException(path, "Truncated EWF segment at " + at);
            at += n;
        }
        return out;
    }

    int chunkSize() {
        return chunkSize;
    }

    int chunkCount() {
        return chunks.size();
    }

    int bytesPerSector() {
        return bytesPerSector;
    }

    long sectorCount() {
        return sectorCount;
    }

    @Override
    public long size() {
        return size;
    }

    @Override
    public void readFully(long pos, byte[] dst, int offset, int length) throws IOException {
        if (pos < 0 || pos + length > size) {
            throw new EOFException("Read of " + length + " bytes at " + pos + " exceeds media size " + size);
        }
        int done = 0;
        while (done < length) {
            long at = pos + done;
            int index = (int) (at / chunkSize);
            int within = (int) (at % chunkSize);
            byte[] chunk = chunk(index);
            int n = Math.min(length - done, chunk.length - within);
            if (n <= 0) throw new EOFException("Chunk " + index + " shorter than expected");
            System.arraycopy(chunk, within, dst, offset + done, n);
            done += n;
        }
    }

    private byte[] chunk(int index) throws IOException {
        synchronized (cache) {
            byte[] cached = cache.get(index);
            if (cached != null) return cached;
        }
        byte[] decoded = decode(index);
        synchronized (cache) {
            cache.put(index, decoded);
        }
        return decoded;
    }

    private byte[] decode(int index) throws IOException {
        Chunk c = chunks.get(index);
        Path path = segmentPaths.get(c.segment());
        int expected = (int) Math.min(chunkSize, size - (long) index * chunkSize);
        byte[] stored = readAt(channels[c.segment()], c.offset(), c.storedLength(), path);
        if (c.compressed()) {
            Inflater inflater = new Inflater();
            try {
                inflater.setInput(stored);
                byte[] out = new byte[chunkSize];
                int total = 0;
                while (total < out.length && !inflater.finished()) {
                    int n = inflater.inflate(out, total, out.length - total);
                    if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) break;
                    total += n;
                }
                if (total < expected) {
                    throw new ImageFormatException(path, "EWF chunk " + index + " inflated to " + total
                            + " bytes, expected " + expected);
                }
                return total == out.length ? out : Arrays.copyOf(out, total);
            } catch (DataFormatException e) {
                throw new ImageFormatException(path, "EWF chunk " + index + " is not valid zlib data", e);
            } finally {
                inflater.end();
            }
        }
        int dataLen = c.storedLength() - 4;
        if (dataLen < expected) {
            throw new ImageFormatException(path, "EWF chunk " + index + " holds " + dataLen
                    + " bytes, expected " + expected);
        }
        Adler32 adler = new Adler32();
        adler.update(stored, 0, dataLen);
        if (adler.getValue() != LittleEndian.u32(stored, dataLen)) {
            throw new ImageFormatException(path, "EWF chunk " + index + " checksum mismatch");
        }
        return Arrays.copyOf(stored, dataLen);
    }

    @Override
    public synchronized int read(ByteBuffer dst) throws IOException {
        if (position >= size) return -1;
        int toRead = (int) Math.min(dst.remaining(), size - position);
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
        position = newPosition;
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
}
