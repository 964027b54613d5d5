package com.libragraph.triage.core.store;

import com.libragraph.triage.core.artifact.Artifact;
import com.libragraph.triage.core.artifact.ArtifactCodec;
import com.libragraph.triage.core.artifact.ArtifactPayload;
import com.libragraph.triage.core.cases.CaseConflictException;
import com.libragraph.triage.core.cases.CaseNotFoundException;
import com.libragraph.triage.core.dao.ArtifactDao;
import com.libragraph.triage.core.dao.ArtifactRow;
import com.libragraph.triage.core.dao.CaseDao;
import com.libragraph.triage.core.dao.JobDao;
import com.libragraph.triage.types.ArtifactType;
import com.libragraph.triage.types.JobState;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.jboss.logging.Logger;

import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Case-scoped artifact persistence. Identity is {@code (case, type, natural key)};
 * storing the same identity again never adds a row, which makes re-extraction safe.
 */
@ApplicationScoped
public class ArtifactStore {

    private static final Logger log = Logger.getLogger(ArtifactStore.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ArtifactCodec codec;

    public ArtifactStore() {
    }

    public ArtifactStore(Jdbi jdbi, ArtifactCodec codec) {
        this.jdbi = jdbi;
        this.codec = codec;
    }

    public UpsertResult upsert(Artifact artifact) {
        return upsert(artifact, null);
    }

    /**
     * Stores an artifact unless its identity already exists. An existing row is
     * rewritten only when the payload's merge rule changes it; its timeline
     * position is kept from the first insert.
     *
     * @param jobId job that produced the artifact, recorded on insert only
     */
    public UpsertResult upsert(Artifact artifact, Long jobId) {
        String keyHash = artifact.keyHash().toHex();
        try {
            return jdbi.inTransaction(handle -> upsertIn(handle, artifact, keyHash, jobId));
        } catch (UnableToExecuteStatementException e) {
            if (!isUniqueViolation(e)) throw e;
            // lost an insert race on the identity; the row now exists
            log.debugf("Concurrent insert of %s %s, retrying as update", artifact.type(), artifact.naturalKey());
            return jdbi.inTransaction(handle -> upsertIn(handle, artifact, keyHash, jobId));
        }
    }

    private UpsertResult upsertIn(Handle handle, Artifact artifact, String keyHash, Long jobId) {
        ArtifactDao dao = handle.attach(ArtifactDao.class);
        Optional<ArtifactRow> existing = dao.findByIdentity(artifact.caseId(), artifact.type(), keyHash);
        Instant now = Instant.now();
        if (existing.isEmpty()) {
            dao.insert(artifact.caseId(), artifact.type(), artifact.naturalKey(), keyHash, artifact.timestamp(),
                    artifact.sourcePath(), artifact.description(), codec.encode(artifact.payload()), jobId, now);
            return UpsertResult.STORED;
        }
        ArtifactRow row = existing.get();
        ArtifactPayload stored = codec.decode(row.payload());
        Optional<ArtifactPayload> merged = stored.mergeWith(artifact.payload());
        if (merged.isEmpty()) {
            return UpsertResult.DUPLICATE;
        }
        // the first stored position on the timeline stays put
        Instant eventTime = row.eventTime() != null ? row.eventTime() : artifact.timestamp();
        dao.updatePayload(row.id(), eventTime, artifact.description(), codec.encode(merged.get()), now);
        log.debugf("Merged %s %s into artifact %d", artifact.type(), artifact.naturalKey(), row.id());
        return UpsertResult.MERGED;
    }

    /**
     * Artifacts of one type, oldest first. The stream holds a database handle
     * until closed.
     */
    public Stream<Artifact> query(String caseId, ArtifactType type, ArtifactFilter filter) {
        Handle handle = jdbi.open();
        try {
            handle.registerRowMapper(ConstructorMapper.factory(ArtifactRow.class));
            return handle.attach(ArtifactDao.class)
                    .select(handle, caseId, type, filter)
                    .mapTo(ArtifactRow.class)
                    .stream()
                    .map(this::toArtifact)
                    .onClose(handle::close);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    /**
     * Every timestamped artifact of the case in timeline order. The stream
     * holds a database handle until closed.
     */
    public Stream<Artifact> timeline(String caseId) {
        Handle handle = jdbi.open();
        try {
            handle.registerRowMapper(ConstructorMapper.factory(ArtifactRow.class));
            return handle.attach(ArtifactDao.class)
                    .selectTimeline(handle, caseId, null, null, List.of(), 0, 0)
                    .mapTo(ArtifactRow.class)
                    .stream()
                    .map(this::toArtifact)
                    .onClose(handle::close);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    /** Materialized {@link #query}. */
    public List<Artifact> list(String caseId, ArtifactType type, ArtifactFilter filter) {
        try (Stream<Artifact> artifacts = query(caseId, type, filter)) {
            return artifacts.toList();
        }
    }

    public Optional<Artifact> find(String caseId, long id) {
        return jdbi.withExtension(ArtifactDao.class, dao -> dao.findById(caseId, id)).map(this::toArtifact);
    }

    /** Every type appears in the result, with zero when the case has none of it. */
    public Map<ArtifactType, Long> countByType(String caseId) {
        Map<ArtifactType, Long> counts = new EnumMap<>(ArtifactType.class);
        for (ArtifactType type : ArtifactType.values()) {
            counts.put(type, 0L);
        }
        counts.putAll(jdbi.withExtension(ArtifactDao.class, dao -> dao.countByType(caseId)));
        return counts;
    }

    public long count(String caseId) {
        return jdbi.withExtension(ArtifactDao.class, dao -> dao.count(caseId));
    }

    public long countTimestamped(String caseId) {
        return jdbi.withExtension(ArtifactDao.class, dao -> dao.countTimestamped(caseId));
    }

    /**
     * Removes the case with its artifacts, jobs, job warnings and reports.
     *
     * @return number of artifacts removed
     * @throws CaseNotFoundException if the case is not registered
     * @throws CaseConflictException if an extraction is queued or running
     */
    public long deleteCase(String caseId) {
        long removed = jdbi.inTransaction(handle -> {
            CaseDao cases = handle.attach(CaseDao.class);
            if (cases.lock(caseId).isEmpty()) {
                throw new CaseNotFoundException(caseId);
            }
            int active = handle.attach(JobDao.class).countInStates(caseId, JobState.QUEUED, JobState.RUNNING);
            if (active > 0) {
                throw new CaseConflictException(caseId, "Case " + caseId + " has an active extraction job");
            }
            long artifacts = handle.attach(ArtifactDao.class).count(caseId);
            cases.delete(caseId);
            return artifacts;
        });
        log.infof("Deleted case %s (%d artifacts)", caseId, removed);
        return removed;
    }

    public Artifact toArtifact(ArtifactRow row) {
        return new Artifact(row.id(), row.caseId(), row.type(), row.naturalKey(), row.eventTime(),
                row.sourcePath(), row.description(), codec.decode(row.payload()));
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("23")) {
                return true;
            }
        }
        return false;
    }
}
