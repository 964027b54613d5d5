package com.libragraph.triage.api;

/**
 * Body of every non-2xx response.
 *
 * @param error short machine-readable kind, e.g. {@code job_conflict}
 */
public record ErrorResponse(String error, String message) {
}
