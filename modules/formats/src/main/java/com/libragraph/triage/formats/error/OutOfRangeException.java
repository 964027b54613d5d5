package com.libragraph.triage.formats.error;

/**
 * A read addressed bytes outside the image. Raised instead of returning a
 * short read so a malformed request is never mistaken for real data.
 */
public class OutOfRangeException extends TriageException {

    private final long offset;
    private final long length;
    private final long size;

    public OutOfRangeException(long offset, long length, long size) {
        super("Read of " + length + " bytes at offset " + offset + " is outside image of " + size + " bytes");
        this.offset = offset;
        this.length = length;
        this.size = size;
    }

    public long offset() {
        return offset;
    }

    public long length() {
        return length;
    }

    public long size() {
        return size;
    }
}
