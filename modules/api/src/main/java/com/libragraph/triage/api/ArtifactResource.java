package com.libragraph.triage.api;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.cases.CaseService;
import com.libragraph.triage.core.store.ArtifactFilter;
import com.libragraph.triage.core.store.ArtifactStore;
import com.libragraph.triage.types.ArtifactType;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Stored artifacts of a case, by type. */
@Path("/api/cases/{caseId}/artifacts")
@Produces(MediaType.APPLICATION_JSON)
public class ArtifactResource {

    static final int MAX_LIMIT = 10_000;

    @Inject
    CaseService cases;

    @Inject
    ArtifactStore store;

    @GET
    @Path("/counts")
    public Map<String, Long> counts(@PathParam("caseId") String caseId) {
        cases.require(caseId);
        Map<String, Long> out = new LinkedHashMap<>();
        store.countByType(caseId).forEach((type, n) -> out.put(type.label(), n));
        return out;
    }

    @GET
    @Path("/{type}")
    public List<Artifact> artifacts(@PathParam("caseId") String caseId,
                                    @PathParam("type") String type,
                                    @QueryParam("from") String from,
                                    @QueryParam("to") String to,
                                    @QueryParam("q") String text,
                                    @QueryParam("limit") @DefaultValue("100") int limit,
                                    @QueryParam("offset") @DefaultValue("0") int offset) {
        cases.require(caseId);
        ArtifactFilter filter = new ArtifactFilter(instant("from", from), instant("to", to), text,
                limit(limit), offset);
        return store.list(caseId, ArtifactType.parse(type), filter);
    }

    static int limit(int requested) {
        if (requested < 1 || requested > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + requested);
        }
        return requested;
    }

    static Instant instant(String name, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' is not an ISO-8601 instant: " + value, e);
        }
    }
}
