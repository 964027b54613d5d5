package com.libragraph.triage.api;

import com.libragraph.triage.core.cases.CaseRecord;
import com.libragraph.triage.core.cases.CaseService;
import com.libragraph.triage.core.job.JobController;
import com.libragraph.triage.core.job.JobStatus;
import com.libragraph.triage.core.job.JobWarning;
import com.libragraph.triage.core.store.ArtifactStore;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

/** Case registration and the extraction jobs of a case. */
@Path("/api/cases")
@Produces(MediaType.APPLICATION_JSON)
public class CaseResource {

    private static final Logger log = Logger.getLogger(CaseResource.class);

    @Inject
    CaseService cases;

    @Inject
    ArtifactStore store;

    @Inject
    JobController controller;

    public record RegisterCase(String imagePath) {
    }

    public record JobAccepted(long jobId, String caseId, String status) {
    }

    @GET
    public List<CaseRecord> list() {
        return cases.list();
    }

    @GET
    @Path("/{caseId}")
    public CaseRecord get(@PathParam("caseId") String caseId) {
        return cases.require(caseId);
    }

    /** Binds a case id to an image; repeating the same binding is harmless. */
    @PUT
    @Path("/{caseId}")
    @Consumes(MediaType.APPLICATION_JSON)
    public CaseRecord register(@PathParam("caseId") String caseId, RegisterCase request) {
        if (request == null || request.imagePath() == null || request.imagePath().isBlank()) {
            throw new IllegalArgumentException("imagePath is required");
        }
        return cases.register(caseId, Paths.get(request.imagePath()));
    }

    @DELETE
    @Path("/{caseId}")
    public Map<String, Object> delete(@PathParam("caseId") String caseId) {
        long removed = store.deleteCase(caseId);
        return Map.of("caseId", caseId, "artifactsDeleted", removed);
    }

    /** Queues an extraction; 202 with the job id, 409 while another job of the case is active. */
    @POST
    @Path("/{caseId}/extractions")
    public Response extract(@PathParam("caseId") String caseId) {
        long jobId = controller.submit(caseId);
        log.debugf("Accepted extraction job %d for case %s", jobId, caseId);
        return Response.accepted(new JobAccepted(jobId, caseId, "queued")).build();
    }

    @GET
    @Path("/{caseId}/extractions")
    public List<JobStatus> extractions(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        return controller.history(caseId);
    }

    @GET
    @Path("/{caseId}/extraction")
    public JobStatus extraction(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        return controller.status(caseId);
    }

    @DELETE
    @Path("/{caseId}/extraction")
    public JobStatus cancel(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        return controller.cancel(caseId);
    }

    @GET
    @Path("/{caseId}/extraction/warnings")
    public List<JobWarning> warnings(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        return controller.warnings(controller.status(caseId).jobId());
    }
}
