package com.libragraph.stageflow.core.db;

import com.libragraph.stageflow.core.dao.DatabaseDao;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;

import java.util.List;

/**
 * Connects to PostgreSQL at boot and checks that the pipeline schema has been migrated.
 */
@ApplicationScoped
@Startup
@IfBuildProperty(name = "stageflow.store.type", stringValue = "postgres", enableIfMissing = true)
public class DatabaseService {

    private static final Logger log = Logger.getLogger(DatabaseService.class);

    static final List<String> PIPELINE_TABLES = List.of(
            "pipeline_job", "queue_message", "dead_letter", "job_event", "job_item", "stage_output", "page");

    @Inject
    Jdbi jdbi;

    private String serverVersion;

    @PostConstruct
    void init() {
        try {
            serverVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::serverVersion);
        } catch (Exception e) {
            throw new RuntimeException("Cannot connect to the pipeline database", e);
        }
        log.infof("Connected to: %s", serverVersion);
        List<String> missing = missingTables();
        if (!missing.isEmpty()) {
            log.warnf("Pipeline schema incomplete, missing tables: %s", missing);
        }
    }

    /** True when the database answers and every pipeline table exists. */
    public boolean ready() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return missingTables().isEmpty();
        } catch (Exception e) {
            log.warnf("Database ping failed: %s", e.getMessage());
            return false;
        }
    }

    public List<String> missingTables() {
        return jdbi.withExtension(DatabaseDao.class, dao -> dao.missingTables(PIPELINE_TABLES));
    }

    public String serverVersion() {
        return serverVersion;
    }
}
