package com.libragraph.triage.core.cases;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.nio.file.Path;
import java.time.Instant;

public record CaseRecord(
        @ColumnName("id") String id,
        @ColumnName("image_path") String imagePath,
        @ColumnName("created_at") Instant createdAt
) {
    public Path image() {
        return Path.of(imagePath);
    }
}
