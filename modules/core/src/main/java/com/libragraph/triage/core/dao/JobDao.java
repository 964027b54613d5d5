package com.libragraph.triage.core.dao;

import com.libragraph.triage.core.job.JobRecord;
import com.libragraph.triage.core.job.JobWarning;
import com.libragraph.triage.types.JobState;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Extraction jobs. State changes are conditional on the current state, so a
 * terminal state is never overwritten; callers check the returned row count.
 */
@RegisterColumnMapper(JobStateColumnMapper.class)
@RegisterArgumentFactory(JobStateArgumentFactory.class)
@RegisterConstructorMapper(JobRecord.class)
@RegisterConstructorMapper(JobWarning.class)
public interface JobDao {

    @SqlUpdate("INSERT INTO extraction_job (case_id, state, created_at) VALUES (:caseId, :state, :createdAt)")
    @GetGeneratedKeys("id")
    long insert(@Bind("caseId") String caseId, @Bind("state") JobState state, @Bind("createdAt") Instant createdAt);

    @SqlQuery("SELECT * FROM extraction_job WHERE id = :id")
    Optional<JobRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM extraction_job WHERE case_id = :caseId ORDER BY id DESC LIMIT 1")
    Optional<JobRecord> findLatest(@Bind("caseId") String caseId);

    @SqlQuery("SELECT * FROM extraction_job WHERE case_id = :caseId AND state = :state ORDER BY id DESC LIMIT 1")
    Optional<JobRecord> findLatestInState(@Bind("caseId") String caseId, @Bind("state") JobState state);

    @SqlQuery("SELECT * FROM extraction_job WHERE case_id = :caseId ORDER BY id")
    List<JobRecord> findByCase(@Bind("caseId") String caseId);

    @SqlQuery("SELECT * FROM extraction_job WHERE case_id = :caseId AND state IN (<states>) ORDER BY id")
    List<JobRecord> findByCaseInStates(@Bind("caseId") String caseId, @BindList("states") JobState... states);

    @SqlQuery("SELECT * FROM extraction_job WHERE state IN (<states>) ORDER BY id")
    List<JobRecord> findInStates(@BindList("states") JobState... states);

    @SqlQuery("SELECT COUNT(*) FROM extraction_job WHERE case_id = :caseId AND state IN (<states>)")
    int countInStates(@Bind("caseId") String caseId, @BindList("states") JobState... states);

    @SqlUpdate("UPDATE extraction_job SET state = :running, started_at = :startedAt " +
            "WHERE id = :id AND state = :queued")
    int markRunning(@Bind("id") long id,
                    @Bind("startedAt") Instant startedAt,
                    @Bind("queued") JobState queued,
                    @Bind("running") JobState running);

    @SqlUpdate("UPDATE extraction_job SET " +
            "artifacts_extracted = GREATEST(artifacts_extracted, :extracted), " +
            "artifacts_stored = GREATEST(artifacts_stored, :stored) " +
            "WHERE id = :id AND state = :running")
    int advance(@Bind("id") long id,
                @Bind("extracted") long extracted,
                @Bind("stored") long stored,
                @Bind("running") JobState running);

    @SqlUpdate("UPDATE extraction_job SET state = :completed, finished_at = :finishedAt " +
            "WHERE id = :id AND state = :running")
    int complete(@Bind("id") long id,
                 @Bind("finishedAt") Instant finishedAt,
                 @Bind("running") JobState running,
                 @Bind("completed") JobState completed);

    @SqlUpdate("UPDATE extraction_job SET state = :failed, error_message = :message, error_type = :errorType, " +
            "finished_at = :finishedAt WHERE id = :id AND state IN (<active>)")
    int fail(@Bind("id") long id,
             @Bind("message") String message,
             @Bind("errorType") String errorType,
             @Bind("finishedAt") Instant finishedAt,
             @Bind("failed") JobState failed,
             @BindList("active") JobState... active);

    @SqlUpdate("INSERT INTO job_warning (job_id, source, message, created_at) " +
            "VALUES (:jobId, :source, :message, :createdAt)")
    void insertWarning(@Bind("jobId") long jobId,
                       @Bind("source") String source,
                       @Bind("message") String message,
                       @Bind("createdAt") Instant createdAt);

    @SqlQuery("SELECT source, message, created_at FROM job_warning WHERE job_id = :jobId ORDER BY id")
    List<JobWarning> warnings(@Bind("jobId") long jobId);
}
