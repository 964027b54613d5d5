package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.error.OutOfRangeException;
import com.libragraph.triage.types.ImageFormat;
import com.libragraph.triage.util.buffer.BinaryData;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * One opened evidence container, exposed as a single randomly addressable
 * byte range regardless of how many segment files back it.
 * Reads are bounds-checked and safe to issue from several threads.
 */
public final class ImageHandle implements Closeable {

    private final Path path;
    private final ImageFormat format;
    private final BinaryData data;
    private final List<Path> segments;
    private final Map<String, String> details;

    public ImageHandle(Path path, ImageFormat format, BinaryData data,
                       List<Path> segments, Map<String, String> details) {
        this.path = path;
        this.format = format;
        this.data = data;
        this.segments = List.copyOf(segments);
        this.details = Map.copyOf(details);
    }

    public Path path() {
        return path;
    }

    public ImageFormat format() {
        return format;
    }

    /** Total addressable size in bytes. */
    public long size() {
        return data.size();
    }

    public int segmentCount() {
        return segments.size();
    }

    public List<Path> segments() {
        return segments;
    }

    /**
     * Reads exactly {@code length} bytes starting at {@code offset}.
     *
     * @throws OutOfRangeException if any requested byte lies outside the image
     */
    public byte[] readAt(long offset, int length) {
        long size = data.size();
        if (offset < 0 || length < 0 || offset > size - length) {
            throw new OutOfRangeException(offset, length, size);
        }
        try {
            return data.read(offset, length);
        } catch (IOException e) {
            throw new UncheckedIOException("Read failed at offset " + offset + " of " + path, e);
        }
    }

    public ImageMetadata metadata() {
        return new ImageMetadata(path.toString(), format, size(), segments.size(), details);
    }

    @Override
    public void close() throws IOException {
        data.close();
    }

    @Override
    public String toString() {
        return format.label() + ":" + path;
    }
}
