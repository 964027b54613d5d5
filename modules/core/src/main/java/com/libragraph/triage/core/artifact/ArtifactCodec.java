package com.libragraph.triage.core.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * JSON form of artifact payloads as stored in the {@code payload} column.
 */
@ApplicationScoped
public class ArtifactCodec {

    @Inject
    ObjectMapper objectMapper;

    public ArtifactCodec() {
    }

    public ArtifactCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Mapper configured like the application one, for use outside a CDI container. */
    public static ObjectMapper standaloneMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public ObjectMapper mapper() {
        return objectMapper;
    }

    public String encode(ArtifactPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + payload.getClass().getSimpleName(), e);
        }
    }

    public ArtifactPayload decode(String json) {
        try {
            return objectMapper.readValue(json, ArtifactPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored artifact payload is not readable: " + e.getOriginalMessage(), e);
        }
    }
}
