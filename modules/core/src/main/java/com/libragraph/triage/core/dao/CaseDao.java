package com.libragraph.triage.core.dao;

import com.libragraph.triage.core.cases.CaseRecord;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(CaseRecord.class)
public interface CaseDao {

    @SqlUpdate("INSERT INTO forensic_case (id, image_path, created_at) VALUES (:id, :imagePath, :createdAt)")
    void insert(@Bind("id") String id, @Bind("imagePath") String imagePath, @Bind("createdAt") Instant createdAt);

    @SqlQuery("SELECT * FROM forensic_case WHERE id = :id")
    Optional<CaseRecord> findById(@Bind("id") String id);

    @SqlQuery("SELECT * FROM forensic_case ORDER BY created_at, id")
    List<CaseRecord> findAll();

    /** Row lock that serializes job submission per case. */
    @SqlQuery("SELECT id FROM forensic_case WHERE id = :id FOR UPDATE")
    Optional<String> lock(@Bind("id") String id);

    @SqlUpdate("DELETE FROM forensic_case WHERE id = :id")
    int delete(@Bind("id") String id);
}
