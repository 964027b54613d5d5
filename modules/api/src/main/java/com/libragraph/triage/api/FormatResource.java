package com.libragraph.triage.api;

import com.libragraph.triage.formats.api.ImageFormatFactory;
import com.libragraph.triage.formats.image.ImageIngestor;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import java.util.List;
import java.util.TreeSet;

/** Evidence container formats the ingestor can open. */
@Path("/api/formats")
@Produces(MediaType.APPLICATION_JSON)
public class FormatResource {

    @Inject
    ImageIngestor ingestor;

    public record FormatInfo(String name, String description, List<String> extensions, int priority) {
    }

    @GET
    public List<FormatInfo> list() {
        return ingestor.formats().stream()
                .map(FormatResource::describe)
                .toList();
    }

    static FormatInfo describe(ImageFormatFactory factory) {
        var criteria = factory.getDetectionCriteria();
        return new FormatInfo(factory.format().label(), factory.format().description(),
                List.copyOf(new TreeSet<>(criteria.extensions())), criteria.priority());
    }
}
