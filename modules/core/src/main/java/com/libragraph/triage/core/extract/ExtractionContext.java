package com.libragraph.triage.core.extract;

import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run state handed to an extractor: who it runs for and where its
 * warnings go.
 */
public final class ExtractionContext {

    private static final Logger log = Logger.getLogger(ExtractionContext.class);

    /** Receives warnings as they are raised. */
    @FunctionalInterface
    public interface WarningSink {
        void warn(ExtractorKind source, String message);
    }

    private final String caseId;
    private final ExtractorKind kind;
    private final WarningSink sink;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    public ExtractionContext(String caseId, ExtractorKind kind, WarningSink sink) {
        this.caseId = caseId;
        this.kind = kind;
        this.sink = sink;
    }

    /** Context that only collects warnings, for running an extractor outside a job. */
    public static ExtractionContext standalone(String caseId, ExtractorKind kind) {
        return new ExtractionContext(caseId, kind, (source, message) -> { });
    }

    public String caseId() {
        return caseId;
    }

    public ExtractorKind kind() {
        return kind;
    }

    public void warn(String message) {
        log.warnf("[%s/%s] %s", caseId, kind.label(), message);
        warnings.add(message);
        sink.warn(kind, message);
    }

    public List<String> warnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }
}
