package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.api.DetectionCriteria;
import com.libragraph.triage.formats.api.ImageFormatFactory;
import com.libragraph.triage.types.ImageFormat;
import com.libragraph.triage.util.buffer.SegmentedBinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Raw images split into numbered pieces ({@code disk.001}, {@code disk.002}, ...).
 * Segments are collected contiguously from {@code .001} until the next number
 * is missing, then stitched into one address space.
 */
@ApplicationScoped
public class SplitRawImageFactory implements ImageFormatFactory {

    @Override
    public ImageFormat format() {
        return ImageFormat.SPLIT_RAW;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(Set.of("001"), null, 0, 100);
    }

    @Override
    public ImageHandle open(Path path, byte[] header) throws IOException {
        List<Path> segments = segmentsOf(path);
        return new ImageHandle(path, ImageFormat.SPLIT_RAW, SegmentedBinaryData.open(segments), segments,
                Map.of("segments", Integer.toString(segments.size())));
    }

    static List<Path> segmentsOf(Path first) {
        String name = first.getFileName().toString();
        String base = name.substring(0, name.length() - 3);
        List<Path> segments = new ArrayList<>();
        for (int n = 1; ; n++) {
            Path candidate = first.resolveSibling(base + String.format("%03d", n));
            if (!Files.isRegularFile(candidate)) break;
            segments.add(candidate);
        }
        return segments;
    }
}
