package com.libragraph.triage.api;

import com.libragraph.triage.core.anomaly.AnomalyDetectionEngine;
import com.libragraph.triage.core.anomaly.AnomalyReport;
import com.libragraph.triage.core.cases.CaseService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.util.List;

@Path("/api/cases/{caseId}/analysis")
@Produces(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    @Inject
    AnomalyDetectionEngine engine;

    @Inject
    CaseService cases;

    /** Runs an analysis and stores its report; earlier reports are kept. */
    @POST
    public Response analyze(@PathParam("caseId") String caseId) {
        AnomalyReport report = engine.analyze(caseId);
        return Response.status(Response.Status.CREATED).entity(report).build();
    }

    @GET
    public List<AnomalyReport> history(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        return engine.history(caseId);
    }

    @GET
    @Path("/latest")
    public AnomalyReport latest(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        return engine.latest(caseId)
                .orElseThrow(() -> new NotFoundException("No analysis report for case " + caseId));
    }

    @GET
    @Path("/{reportId}")
    public AnomalyReport report(@PathParam("caseId") String caseId, @PathParam("reportId") long reportId) {
        return engine.report(caseId, reportId)
                .orElseThrow(() -> new NotFoundException("No report " + reportId + " for case " + caseId));
    }
}
