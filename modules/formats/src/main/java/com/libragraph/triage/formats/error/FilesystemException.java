package com.libragraph.triage.formats.error;

/**
 * The image holds no partition table or filesystem this walker supports.
 * Fatal at mount time.
 */
public class FilesystemException extends TriageException {

    public FilesystemException(String message) {
        super(message);
    }

    public FilesystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
