package com.libragraph.triage.formats.error;

import java.nio.file.Path;

/**
 * The evidence container is unrecognized, truncated, or its headers are corrupt.
 * Fatal for an extraction job and never retried.
 */
public class ImageFormatException extends TriageException {

    private final Path path;

    public ImageFormatException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ImageFormatException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
