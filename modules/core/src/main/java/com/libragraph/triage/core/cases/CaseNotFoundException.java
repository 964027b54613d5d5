package com.libragraph.triage.core.cases;

import com.libragraph.triage.formats.error.TriageException;

public class CaseNotFoundException extends TriageException {

    private final String caseId;

    public CaseNotFoundException(String caseId) {
        super("Case not found: " + caseId);
        this.caseId = caseId;
    }

    public String caseId() {
        return caseId;
    }
}
