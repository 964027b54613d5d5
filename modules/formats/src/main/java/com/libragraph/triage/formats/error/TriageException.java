package com.libragraph.triage.formats.error;

/**
 * Root of the triage error taxonomy. Unchecked: callers decide per layer
 * whether a failure is fatal (ingestion, mount) or recoverable (one extractor).
 */
public class TriageException extends RuntimeException {

    public TriageException(String message) {
        super(message);
    }

    public TriageException(String message, Throwable cause) {
        super(message, cause);
    }
}
