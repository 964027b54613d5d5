package com.libragraph.triage.core.cases;

import com.libragraph.triage.formats.error.TriageException;

/**
 * A case registration that contradicts the existing record, or a delete
 * attempted while the case is being extracted.
 */
public class CaseConflictException extends TriageException {

    private final String caseId;

    public CaseConflictException(String caseId, String message) {
        super(message);
        this.caseId = caseId;
    }

    public String caseId() {
        return caseId;
    }
}
