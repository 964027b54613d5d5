package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.formats.error.TriageException;

/**
 * Analysis was requested while the case's artifacts are incomplete: an
 * extraction is still active, or none has completed.
 */
public class AnalysisNotReadyException extends TriageException {

    private final String caseId;

    public AnalysisNotReadyException(String caseId, String message) {
        super(message);
        this.caseId = caseId;
    }

    public String caseId() {
        return caseId;
    }
}
