package com.libragraph.triage.core.anomaly;

import com.libragraph.triage.formats.error.TriageException;

public class InsufficientDataException extends TriageException {

    private final String caseId;

    public InsufficientDataException(String caseId) {
        super("Case " + caseId + " has no timestamped artifacts to analyze");
        this.caseId = caseId;
    }

    public String caseId() {
        return caseId;
    }
}
