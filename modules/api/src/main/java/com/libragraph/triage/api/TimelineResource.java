package com.libragraph.triage.api;

import com.libragraph.triage.core.cases.CaseService;
import com.libragraph.triage.core.timeline.TimelineBuilder;
import com.libragraph.triage.core.timeline.TimelineEvent;
import com.libragraph.triage.core.timeline.TimelineQuery;
import com.libragraph.triage.types.ArtifactType;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.libragraph.triage.api.ArtifactResource.instant;
import static com.libragraph.triage.api.ArtifactResource.limit;

@Path("/api/cases/{caseId}/timeline")
@Produces(MediaType.APPLICATION_JSON)
public class TimelineResource {

    @Inject
    CaseService cases;

    @Inject
    TimelineBuilder timeline;

    /** Events in time order; {@code type} may repeat to select several artifact types. */
    @GET
    public List<TimelineEvent> list(@PathParam("caseId") String caseId,
                                    @QueryParam("from") String from,
                                    @QueryParam("to") String to,
                                    @QueryParam("type") List<String> types,
                                    @QueryParam("limit") @DefaultValue("100") int limit,
                                    @QueryParam("offset") @DefaultValue("0") int offset) {
        cases.require(caseId);
        Set<ArtifactType> selected = EnumSet.noneOf(ArtifactType.class);
        if (types != null) {
            for (String t : types) selected.add(ArtifactType.parse(t));
        }
        return timeline.list(caseId, new TimelineQuery(instant("from", from), instant("to", to), selected,
                limit(limit), offset));
    }
}
