package com.libragraph.stageflow.core.health;

import com.libragraph.stageflow.core.db.DatabaseService;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Ready once the job store database answers and the pipeline tables exist.
 */
@Readiness
@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "postgres", enableIfMissing = true)
public class DatabaseHealthCheck implements HealthCheck {

    @Inject
    DatabaseService databaseService;

    @Override
    public HealthCheckResponse call() {
        if (databaseService.ready()) {
            return HealthCheckResponse.named("job-store")
                    .up()
                    .withData("version", databaseService.serverVersion())
                    .build();
        }
        return HealthCheckResponse.named("job-store")
                .down()
                .withData("error", "database unreachable or schema not migrated")
                .build();
    }
}
