package com.libragraph.stageflow.core.rescue;

import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageRegistry;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;

import static io.quarkus.scheduler.Scheduled.ConcurrentExecution.SKIP;

/**
 * Periodic rescue of every registered pipeline plus release of expired leases.
 */
@ApplicationScoped
public class RescueSweep {

    private static final Logger log = Logger.getLogger(RescueSweep.class);

    @Inject
    RescueService rescueService;

    @Inject
    StageRegistry registry;

    @Inject
    JobStore store;

    @Inject
    Clock clock;

    @ConfigProperty(name = "stageflow.rescue.min-age-minutes", defaultValue = "30")
    int minAgeMinutes;

    @ConfigProperty(name = "stageflow.rescue.max-jobs", defaultValue = "10")
    int maxJobs;

    @Scheduled(every = "${stageflow.rescue.every:5m}", concurrentExecution = SKIP)
    public void sweep() {
        int released = store.clearExpiredLeases(clock.instant());
        if (released > 0) {
            log.warnf("Released %d expired leases", released);
        }
        for (PipelineDefinition pipeline : registry.pipelines()) {
            try {
                rescueService.rescue(new RescueRequest(pipeline.name(), minAgeMinutes, maxJobs));
            } catch (RuntimeException e) {
                log.errorf(e, "Rescue sweep of %s failed", pipeline.name());
            }
        }
    }
}
