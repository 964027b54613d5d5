package com.libragraph.triage.core.anomaly;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/** Stored report: the summary columns are derived from {@code body}. */
public record ReportRow(
        @ColumnName("id") long id,
        @ColumnName("body") String body
) {}
