package com.libragraph.triage.core.dao;

import com.libragraph.triage.core.store.ArtifactFilter;
import org.jdbi.v3.core.statement.Query;

import java.util.Locale;

/** SQL fragments shared by the dynamic artifact queries. */
final class ArtifactSql {

    private ArtifactSql() {
    }

    static void appendFilter(StringBuilder sql, ArtifactFilter filter) {
        if (filter.from() != null) sql.append(" AND event_time >= :from");
        if (filter.to() != null) sql.append(" AND event_time < :to");
        if (filter.text() != null) {
            sql.append(" AND (LOWER(natural_key) LIKE :pattern OR LOWER(description) LIKE :pattern)");
        }
    }

    static Query bindFilter(Query query, ArtifactFilter filter) {
        if (filter.from() != null) query.bind("from", filter.from());
        if (filter.to() != null) query.bind("to", filter.to());
        if (filter.text() != null) {
            String escaped = filter.text().toLowerCase(Locale.ROOT)
                    .replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
            query.bind("pattern", "%" + escaped + "%");
        }
        return query;
    }

    static void appendPage(StringBuilder sql, int limit, int offset) {
        if (limit > 0) sql.append(" LIMIT ").append(limit);
        if (offset > 0) sql.append(" OFFSET ").append(offset);
    }
}
