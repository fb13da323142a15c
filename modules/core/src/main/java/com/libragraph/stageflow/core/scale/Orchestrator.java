package com.libragraph.stageflow.core.scale;

import com.libragraph.stageflow.core.intake.ValidationException;
import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.StageDepth;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageBinding;
import com.libragraph.stageflow.core.stage.StageRegistry;
import com.libragraph.stageflow.core.worker.WorkerLauncher;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Launches stage workers in proportion to backlog until the queues drain or the run's
 * duration elapses.
 *
 * <p>Backlog is the number of messages visible now. Messages held back by retry backoff are
 * not backlog; the run counts as drained once nothing is visible and no job is leased.
 */
@ApplicationScoped
public class Orchestrator {

    private static final Logger log = Logger.getLogger(Orchestrator.class);

    static final Duration CYCLE_PAUSE = Duration.ofSeconds(30);
    static final Duration ERROR_PAUSE = Duration.ofSeconds(10);

    @Inject
    StageRegistry registry;

    @Inject
    MessageQueue queue;

    @Inject
    JobStore store;

    @Inject
    WorkerLauncher launcher;

    @Inject
    Clock clock;

    Sleeper sleeper = Sleeper.THREAD;

    public OrchestratorSummary run(OrchestratorRequest request) {
        OrchestratorRequest req = request != null ? request : OrchestratorRequest.defaults();
        ScalingLimits limits;
        try {
            limits = req.limits();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
        if (req.durationOrDefault() <= 0) {
            throw new ValidationException("durationMinutes must be positive");
        }
        List<PipelineDefinition> pipelines = scope(req.pipeline());

        String id = UUID.randomUUID().toString();
        Instant start = clock.instant();
        Instant deadline = start.plus(Duration.ofMinutes(req.durationOrDefault()));
        Map<String, long[]> stats = new LinkedHashMap<>();
        int cycles = 0;
        int launched = 0;
        int errors = 0;
        log.infof("Orchestrator %s started: maxWorkers=%d, workersPerStage=%d, duration=%dm",
                id, limits.maxWorkers(), limits.workersPerStage(), req.durationOrDefault());

        while (true) {
            cycles++;
            Duration pause = CYCLE_PAUSE;
            try {
                store.clearExpiredLeases(clock.instant());
                Cycle cycle = observe(pipelines);
                ScalingPlan plan = ScalingPolicy.plan(cycle.backlogs(), cycle.activeWorkers(), limits);
                for (ScalingPlan.Launch launch : plan.launches()) {
                    long[] s = stats.computeIfAbsent(launch.workerName(), k -> new long[2]);
                    s[0] = launch.backlog();
                    for (int i = 0; i < launch.count(); i++) {
                        if (launcher.launch(launch.workerName())) {
                            s[1]++;
                            launched++;
                        } else {
                            errors++;
                        }
                    }
                }
                log.infof("Orchestrator %s cycle %d: backlog=%d, active=%d, launched=%d (ideal %d, scale %.2f)",
                        id, cycles, cycle.totalBacklog(), cycle.activeWorkers(), plan.total(),
                        plan.idealTotal(), plan.scale());
                if (cycle.totalBacklog() == 0 && cycle.activeWorkers() == 0) {
                    log.infof("Orchestrator %s: all queues drained", id);
                    break;
                }
            } catch (RuntimeException e) {
                errors++;
                pause = ERROR_PAUSE;
                log.errorf(e, "Orchestrator %s cycle %d failed", id, cycles);
            }

            if (!clock.instant().isBefore(deadline)) {
                log.infof("Orchestrator %s: duration elapsed", id);
                break;
            }
            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warnf("Orchestrator %s interrupted", id);
                break;
            }
        }

        Instant end = clock.instant();
        Map<String, OrchestratorSummary.WorkerStats> stageStats = new LinkedHashMap<>();
        stats.forEach((worker, s) -> stageStats.put(worker, new OrchestratorSummary.WorkerStats(s[0], (int) s[1])));
        return new OrchestratorSummary(id, start, end, Duration.between(start, end).toMillis(),
                cycles, launched, stageStats, errors);
    }

    private List<PipelineDefinition> scope(String pipeline) {
        if (pipeline == null || pipeline.isBlank()) {
            return new ArrayList<>(registry.pipelines());
        }
        return List.of(registry.pipeline(pipeline)
                .orElseThrow(() -> new ValidationException("Unknown pipeline: " + pipeline)));
    }

    private Cycle observe(List<PipelineDefinition> pipelines) {
        List<StageBacklog> backlogs = new ArrayList<>();
        long totalBacklog = 0;
        long active = 0;
        for (PipelineDefinition pipeline : pipelines) {
            Map<String, Long> depthByStage = new LinkedHashMap<>();
            for (StageDepth d : queue.depth(pipeline.name())) {
                depthByStage.put(d.stage(), d.ready());
            }
            for (long leases : store.activeLeases(pipeline.name()).values()) {
                active += leases;
            }
            for (StageBinding binding : registry.bindings(pipeline.name())) {
                long backlog = depthByStage.getOrDefault(binding.stage(), 0L);
                totalBacklog += backlog;
                backlogs.add(new StageBacklog(binding.workerName(), backlog, binding.jobsPerWorker()));
            }
        }
        return new Cycle(backlogs, (int) Math.min(active, Integer.MAX_VALUE), totalBacklog);
    }

    private record Cycle(List<StageBacklog> backlogs, int activeWorkers, long totalBacklog) {}
}
