package com.libragraph.triage.formats.image;

import com.libragraph.triage.formats.api.DetectionCriteria;
import com.libragraph.triage.formats.api.ImageFormatFactory;
import com.libragraph.triage.types.ImageFormat;
import com.libragraph.triage.util.buffer.SegmentedBinaryData;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Single-file raw (dd) images. Priority 0: the fallback for anything
 * that no container format claims.
 */
@ApplicationScoped
public class RawImageFactory implements ImageFormatFactory {

    @Override
    public ImageFormat format() {
        return ImageFormat.RAW;
    }

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return DetectionCriteria.catchAll(0);
    }

    @Override
    public ImageHandle open(Path path, byte[] header) throws IOException {
        List<Path> segments = List.of(path);
        return new ImageHandle(path, ImageFormat.RAW, SegmentedBinaryData.open(segments), segments, Map.of());
    }
}
