package com.libragraph.triage.formats.error;

/**
 * A structure is present but does not decode (bad signature, offsets out of
 * bounds, truncated records). Extractors turn this into a job warning.
 */
public class CorruptStructureException extends TriageException {

    private final String structure;

    public CorruptStructureException(String structure, String message) {
        super(structure + ": " + message);
        this.structure = structure;
    }

    public CorruptStructureException(String structure, String message, Throwable cause) {
        super(structure + ": " + message, cause);
        this.structure = structure;
    }

    public String structure() {
        return structure;
    }
}
