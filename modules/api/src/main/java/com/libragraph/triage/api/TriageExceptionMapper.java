package com.libragraph.triage.api;

import com.libragraph.triage.core.anomaly.AnalysisNotReadyException;
import com.libragraph.triage.core.anomaly.InsufficientDataException;
import com.libragraph.triage.core.cases.CaseConflictException;
import com.libragraph.triage.core.cases.CaseNotFoundException;
import com.libragraph.triage.core.job.JobConflictException;
import com.libragraph.triage.core.job.JobNotFoundException;
import com.libragraph.triage.formats.error.FileNotFoundInImageException;
import com.libragraph.triage.formats.error.FilesystemException;
import com.libragraph.triage.formats.error.ImageFormatException;
import com.libragraph.triage.formats.error.TriageException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

/**
 * Maps domain exceptions to HTTP statuses: conflicts to 409, missing
 * cases/jobs/files to 404, analysis preconditions to 422, bad input to 400.
 */
public class TriageExceptionMapper {

    private static final Logger log = Logger.getLogger(TriageExceptionMapper.class);

    @ServerExceptionMapper
    public Response conflict(JobConflictException e) {
        return respond(Response.Status.CONFLICT, "job_conflict", e);
    }

    @ServerExceptionMapper
    public Response caseConflict(CaseConflictException e) {
        return respond(Response.Status.CONFLICT, "case_conflict", e);
    }

    @ServerExceptionMapper
    public Response caseNotFound(CaseNotFoundException e) {
        return respond(Response.Status.NOT_FOUND, "case_not_found", e);
    }

    @ServerExceptionMapper
    public Response jobNotFound(JobNotFoundException e) {
        return respond(Response.Status.NOT_FOUND, "job_not_found", e);
    }

    @ServerExceptionMapper
    public Response fileNotFound(FileNotFoundInImageException e) {
        return respond(Response.Status.NOT_FOUND, "file_not_found", e);
    }

    @ServerExceptionMapper
    public Response insufficientData(InsufficientDataException e) {
        return respond(422, "insufficient_data", e);
    }

    @ServerExceptionMapper
    public Response notReady(AnalysisNotReadyException e) {
        return respond(422, "analysis_not_ready", e);
    }

    @ServerExceptionMapper
    public Response imageFormat(ImageFormatException e) {
        return respond(Response.Status.BAD_REQUEST, "image_format", e);
    }

    @ServerExceptionMapper
    public Response filesystem(FilesystemException e) {
        return respond(422, "filesystem", e);
    }

    @ServerExceptionMapper
    public Response badRequest(IllegalArgumentException e) {
        return respond(Response.Status.BAD_REQUEST, "bad_request", e);
    }

    @ServerExceptionMapper
    public Response other(TriageException e) {
        log.errorf(e, "Unhandled %s", e.getClass().getSimpleName());
        return respond(Response.Status.INTERNAL_SERVER_ERROR, "internal", e);
    }

    private static Response respond(Response.Status status, String error, Exception e) {
        return respond(status.getStatusCode(), error, e);
    }

    private static Response respond(int status, String error, Exception e) {
        log.debugf("%d %s: %s", status, error, e.getMessage());
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(error, e.getMessage()))
                .build();
    }
}
