package com.libragraph.triage.formats.api;

import com.libragraph.triage.formats.image.ImageHandle;
import com.libragraph.triage.types.ImageFormat;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens one kind of evidence container.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface ImageFormatFactory {

    ImageFormat format();

    /**
     * Returns criteria for detecting when this factory should be used.
     */
    DetectionCriteria getDetectionCriteria();

    /**
     * Opens the container whose first (or only) file is {@code path}.
     *
     * @param path   first segment of the container
     * @param header leading bytes of that file, already read for detection
     * @throws com.libragraph.triage.formats.error.ImageFormatException if the container is malformed
     */
    ImageHandle open(Path path, byte[] header) throws IOException;
}
