package com.libragraph.triage.core.dao;

import com.libragraph.triage.core.store.ArtifactFilter;
import com.libragraph.triage.types.ArtifactType;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.sqlobject.config.KeyColumn;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.ValueColumn;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RegisterConstructorMapper(ArtifactRow.class)
public interface ArtifactDao {

    /** Timeline order: timestamp, then type name, then natural key. */
    String TIMELINE_ORDER = "event_time, artifact_type, natural_key, id";

    @SqlQuery("SELECT * FROM artifact WHERE case_id = :caseId AND artifact_type = :type AND key_hash = :keyHash")
    Optional<ArtifactRow> findByIdentity(@Bind("caseId") String caseId,
                                                   @Bind("type") ArtifactType type,
                                                   @Bind("keyHash") String keyHash);

    @SqlQuery("SELECT * FROM artifact WHERE case_id = :caseId AND id = :id")
    Optional<ArtifactRow> findById(@Bind("caseId") String caseId, @Bind("id") long id);

    @SqlUpdate("INSERT INTO artifact (case_id, artifact_type, natural_key, key_hash, event_time, source_path, " +
            "description, payload, job_id, extracted_at, updated_at) " +
            "VALUES (:caseId, :type, :naturalKey, :keyHash, :eventTime, :sourcePath, " +
            ":description, :payload, :jobId, :now, :now)")
    @GetGeneratedKeys("id")
    long insert(@Bind("caseId") String caseId,
                @Bind("type") ArtifactType type,
                @Bind("naturalKey") String naturalKey,
                @Bind("keyHash") String keyHash,
                @Bind("eventTime") Instant eventTime,
                @Bind("sourcePath") String sourcePath,
                @Bind("description") String description,
                @Bind("payload") String payload,
                @Bind("jobId") Long jobId,
                @Bind("now") Instant now);

    @SqlUpdate("UPDATE artifact SET event_time = :eventTime, description = :description, payload = :payload, " +
            "updated_at = :now WHERE id = :id")
    void updatePayload(@Bind("id") long id,
                       @Bind("eventTime") Instant eventTime,
                       @Bind("description") String description,
                       @Bind("payload") String payload,
                       @Bind("now") Instant now);

    @SqlQuery("SELECT artifact_type, COUNT(*) AS n FROM artifact WHERE case_id = :caseId GROUP BY artifact_type")
    @KeyColumn("artifact_type")
    @ValueColumn("n")
    Map<ArtifactType, Long> countByType(@Bind("caseId") String caseId);

    @SqlQuery("SELECT COUNT(*) FROM artifact WHERE case_id = :caseId")
    long count(@Bind("caseId") String caseId);

    @SqlQuery("SELECT COUNT(*) FROM artifact WHERE case_id = :caseId AND event_time IS NOT NULL")
    long countTimestamped(@Bind("caseId") String caseId);

    /**
     * Artifacts of one type, oldest first with untimed ones last.
     * The returned query is lazy; the caller owns the handle.
     */
    default Query select(Handle handle, String caseId, ArtifactType type, ArtifactFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM artifact WHERE case_id = :caseId AND artifact_type = :type");
        ArtifactSql.appendFilter(sql, filter);
        sql.append(" ORDER BY event_time NULLS LAST, natural_key, id");
        ArtifactSql.appendPage(sql, filter.limit(), filter.offset());
        Query query = handle.createQuery(sql.toString())
                .bind("caseId", caseId)
                .bind("type", type);
        return ArtifactSql.bindFilter(query, filter);
    }

    /**
     * Timestamped artifacts in timeline order, optionally restricted to some types.
     * The returned query is lazy; the caller owns the handle.
     */
    default Query selectTimeline(Handle handle, String caseId, Instant from, Instant to,
                                 Collection<ArtifactType> types, int limit, int offset) {
        StringBuilder sql = new StringBuilder(
                "SELECT * FROM artifact WHERE case_id = :caseId AND event_time IS NOT NULL");
        if (from != null) sql.append(" AND event_time >= :from");
        if (to != null) sql.append(" AND event_time < :to");
        if (types != null && !types.isEmpty()) {
            // enum names are fixed identifiers, safe to inline
            sql.append(types.stream().map(t -> "'" + t.name() + "'")
                    .collect(Collectors.joining(", ", " AND artifact_type IN (", ")")));
        }
        sql.append(" ORDER BY ").append(TIMELINE_ORDER);
        ArtifactSql.appendPage(sql, limit, offset);
        Query query = handle.createQuery(sql.toString()).bind("caseId", caseId);
        if (from != null) query.bind("from", from);
        if (to != null) query.bind("to", to);
        return query;
    }
}
