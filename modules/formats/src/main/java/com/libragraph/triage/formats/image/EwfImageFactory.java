package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.api.DetectionCriteria;
import com.libragraph.triage.formats.api.ImageFormatFactory;
import com.libragraph.triage.formats.error.ImageFormatException;
import com.libragraph.triage.types.ImageFormat;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Expert Witness (EWF-E01) segmented containers.
 * Priority 200: the signature is authoritative over any extension.
 */
@ApplicationScoped
public class EwfImageFactory implements ImageFormatFactory {

    static final byte[] EVF_SIGNATURE = {'E', 'V', 'F', 0x09, 0x0D, 0x0A, (byte) 0xFF, 0x00};

    @Override
    public ImageFormat format() {
        return ImageFormat.EWF;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(Set.of("e01"), EVF_SIGNATURE, 0, 200);
    }

    @Override
    public ImageHandle open(Path path, byte[] header) throws IOException {
        if (!getDetectionCriteria().matchesMagic(header)) {
            throw new ImageFormatException(path, "Missing EWF signature");
        }
        List<Path> segments = segmentsOf(path);
        EwfImage image = EwfImage.open(segments);
        return new ImageHandle(path, ImageFormat.EWF, image, segments, Map.of(
                "chunkSize", Integer.toString(image.chunkSize()),
                "chunkCount", Integer.toString(image.chunkCount()),
                "bytesPerSector", Integer.toString(image.bytesPerSector()),
                "sectorCount", Long.toString(image.sectorCount())));
    }

    /**
     * Collects {@code .E01}, {@code .E02}, ... next to the first segment,
     * keeping the case of the first segment's extension.
     */
    static List<Path> segmentsOf(Path first) {
        String name = first.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot + 1) : name + ".";
        boolean lower = dot > 0 && Character.isLowerCase(name.charAt(dot + 1));

        List<Path> segments = new ArrayList<>();
        segments.add(first);
        for (int n = 2; n <= 1000; n++) {
            String ext = segmentExtension(n);
            Path candidate = first.resolveSibling(base + (lower ? ext.toLowerCase(Locale.ROOT) : ext));
            if (!Files.isRegularFile(candidate)) break;
            segments.add(candidate);
        }
        return segments;
    }

    /**
     * Extension of segment {@code n} (1-based): E01..E99, then EAA..EZZ, FAA...
     */
    static String segmentExtension(int n) {
        if (n < 1) throw new IllegalArgumentException("Segment numbers start at 1: " + n);
        if (n <= 99) return String.format("E%02d", n);
        int idx = n - 100;
        char first = (char) ('E' + idx / (26 * 26));
        char second = (char) ('A' + (idx / 26) % 26);
        char third = (char) ('A' + idx % 26);
        return "" + first + second + third;
    }
}
