package com.libragraph.triage.core.timeline;

import com.libragraph.triage.core.dao.ArtifactDao;
import com.libragraph.triage.core.dao.ArtifactRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;

import java.util.List;
import java.util.stream.Stream;

/**
 * Case timeline as a read-through projection of the artifact table. Events are
 * ordered by timestamp, then artifact type name, then natural key, so the
 * sequence is reproducible and only grows as artifacts are added.
 */
@ApplicationScoped
public class TimelineBuilder {

    @Inject
    Jdbi jdbi;

    public TimelineBuilder() {
    }

    public TimelineBuilder(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    /** All timeline events of the case. The stream holds a database handle until closed. */
    public Stream<TimelineEvent> build(String caseId) {
        return query(caseId, TimelineQuery.ALL);
    }

    /** The stream holds a database handle until closed. */
    public Stream<TimelineEvent> query(String caseId, TimelineQuery q) {
        Handle handle = jdbi.open();
        try {
            handle.registerRowMapper(ConstructorMapper.factory(ArtifactRow.class));
            return handle.attach(ArtifactDao.class)
                    .selectTimeline(handle, caseId, q.from(), q.to(), q.types(), q.limit(), q.offset())
                    .mapTo(ArtifactRow.class)
                    .stream()
                    .map(TimelineBuilder::toEvent)
                    .onClose(handle::close);
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }
    }

    public List<TimelineEvent> list(String caseId, TimelineQuery q) {
        try (Stream<TimelineEvent> events = query(caseId, q)) {
            return events.toList();
        }
    }

    private static TimelineEvent toEvent(ArtifactRow row) {
        return new TimelineEvent(row.caseId(), row.eventTime(), row.type(), row.description(), row.id(),
                row.naturalKey());
    }
}
