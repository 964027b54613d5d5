package com.libragraph.triage.core.db;

import com.libragraph.triage.core.dao.DatabaseDao;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Root infrastructure service. Starts eagerly at boot via {@code @Startup},
 * applies the schema script and verifies connectivity before any other
 * component touches the store.
 */
@ApplicationScoped
@Startup
public class DatabaseService {

    private static final Logger log = Logger.getLogger(DatabaseService.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    @Inject
    Jdbi jdbi;

    private volatile String productVersion;

    @PostConstruct
    void init() {
        try {
            applySchema(jdbi);
            productVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::productVersion);
            log.infof("Connected to: %s", productVersion);
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    /** Creates missing tables and indexes. Idempotent. */
    public static void applySchema(Jdbi jdbi) {
        String script = loadSchema();
        jdbi.useHandle(handle -> handle.createScript(script).execute());
        log.debug("Schema applied");
    }

    /** Executes SELECT 1 to verify connectivity. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            log.warnf("Database ping failed: %s", e.getMessage());
            return false;
        }
    }

    public String productVersion() {
        return productVersion;
    }

    private static String loadSchema() {
        try (InputStream in = DatabaseService.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + SCHEMA_RESOURCE, e);
        }
    }
}
