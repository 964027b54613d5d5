package com.libragraph.triage.core.cases;

import com.libragraph.triage.core.dao.CaseDao;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The minimal case record the pipeline needs: an identifier bound to one
 * evidence container. Case metadata beyond that belongs to the caller.
 * Deletion lives in {@link com.libragraph.triage.core.store.ArtifactStore#deleteCase}.
 */
@ApplicationScoped
public class CaseService {

    private static final Logger log = Logger.getLogger(CaseService.class);

    @Inject
    Jdbi jdbi;

    public CaseService() {
    }

    public CaseService(Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    /**
     * Registers a case. Registering the same id with the same image again is a no-op.
     *
     * @throws CaseConflictException if the id is already bound to another image
     */
    public CaseRecord register(String caseId, Path image) {
        if (caseId == null || caseId.isBlank()) {
            throw new IllegalArgumentException("Case id must not be blank");
        }
        String imagePath = image.toAbsolutePath().normalize().toString();
        return jdbi.inTransaction(handle -> {
            CaseDao dao = handle.attach(CaseDao.class);
            Optional<CaseRecord> existing = dao.findById(caseId);
            if (existing.isPresent()) {
                if (!existing.get().imagePath().equals(imagePath)) {
                    throw new CaseConflictException(caseId, "Case " + caseId
                            + " is already bound to image " + existing.get().imagePath());
                }
                return existing.get();
            }
            dao.insert(caseId, imagePath, Instant.now());
            log.infof("Registered case %s for image %s", caseId, imagePath);
            return dao.findById(caseId).orElseThrow();
        });
    }

    public Optional<CaseRecord> find(String caseId) {
        return jdbi.withExtension(CaseDao.class, dao -> dao.findById(caseId));
    }

    /** @throws CaseNotFoundException if the case is not registered */
    public CaseRecord require(String caseId) {
        return find(caseId).orElseThrow(() -> new CaseNotFoundException(caseId));
    }

    public List<CaseRecord> list() {
        return jdbi.withExtension(CaseDao.class, CaseDao::findAll);
    }
}
