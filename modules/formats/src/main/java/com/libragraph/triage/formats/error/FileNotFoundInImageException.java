package com.libragraph.triage.formats.error;

/**
 * A path looked up inside a mounted volume does not exist.
 */
public class FileNotFoundInImageException extends TriageException {

    private final int volume;
    private final String path;

    public FileNotFoundInImageException(int volume, String path) {
        super("File not found in volume " + volume + ": " + path);
        this.volume = volume;
        this.path = path;
    }

    public int volume() {
        return volume;
    }

    public String path() {
        return path;
    }
}
