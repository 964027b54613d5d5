package com.libragraph.triage.formats.image;

import com.libragraph.triage.types.ImageFormat;

import java.util.Map;

/**
 * Descriptive facts about an opened container, for logging and job metadata.
 *
 * @param details format-specific geometry (EWF chunk size, sector size, ...)
 */
public record ImageMetadata(
        String path,
        ImageFormat format,
        long size,
        int segmentCount,
        Map<String, String> details
) {}
