package com.libragraph.stageflow.core.scale;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Runs the orchestrator on a schedule. Disabled unless {@code stageflow.orchestrator.every} is set.
 */
@ApplicationScoped
public class OrchestratorSchedule {

    private static final Logger log = Logger.getLogger(OrchestratorSchedule.class);

    @Inject
    Orchestrator orchestrator;

    @ConfigProperty(name = "stageflow.orchestrator.max-workers", defaultValue = "20")
    int maxWorkers;

    @ConfigProperty(name = "stageflow.orchestrator.workers-per-stage", defaultValue = "5")
    int workersPerStage;

    @ConfigProperty(name = "stageflow.orchestrator.duration-minutes", defaultValue = "5")
    int durationMinutes;

    @Scheduled(every = "${stageflow.orchestrator.every:off}", concurrentExecution = SKIP)
    void tick() {
        OrchestratorSummary summary = orchestrator.run(
                new OrchestratorRequest(maxWorkers, workersPerStage, durationMinutes, null));
        log.infof("Scheduled orchestrator run %s: %d cycles, %d workers launched, %d errors",
                summary.orchestratorId(), summary.cycles(), summary.workersLaunched(), summary.errors());
    }
}
