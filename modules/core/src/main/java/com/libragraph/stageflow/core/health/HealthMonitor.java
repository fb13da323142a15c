package com.libragraph.stageflow.core.health;

import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.job.StageStats;
import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.StageDepth;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageRegistry;
import com.libragraph.stageflow.types.AlertSeverity;
import com.libragraph.stageflow.types.HealthStatus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only evaluation of per-stage metrics against alert thresholds.
 */
@ApplicationScoped
public class HealthMonitor {

    private static final Logger log = Logger.getLogger(HealthMonitor.class);

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    @Inject
    StageRegistry registry;

    @Inject
    JobStore store;

    @Inject
    MessageQueue queue;

    @Inject
    Clock clock;

    public HealthReport evaluate(HealthThresholds thresholds) {
        return evaluate(thresholds, DEFAULT_WINDOW);
    }

    public HealthReport evaluate(HealthThresholds thresholds, Duration window) {
        Instant now = clock.instant();
        List<StageHealth> stages = new ArrayList<>();
        List<HealthAlert> alerts = new ArrayList<>();

        for (PipelineDefinition pipeline : registry.pipelines()) {
            Map<String, StageStats> stats = new HashMap<>();
            for (StageStats s : store.stageStats(pipeline.name(), now.minus(window))) {
                stats.put(s.stage(), s);
            }
            Map<String, Long> depth = new HashMap<>();
            for (StageDepth d : queue.depth(pipeline.name())) {
                depth.put(d.stage(), d.total());
            }
            Map<String, Long> leases = store.activeLeases(pipeline.name());

            for (String stage : pipeline.stages()) {
                StageStats s = stats.get(stage);
                StageHealth health = new StageHealth(pipeline.name(), stage,
                        s != null ? s.attempts() : 0,
                        s != null ? s.failures() : 0,
                        s != null ? s.errorRate() : 0.0,
                        s != null ? s.avgDurationMs() : 0.0,
                        s != null ? s.p95DurationMs() : 0.0,
                        depth.getOrDefault(stage, 0L),
                        leases.getOrDefault(stage, 0L));
                stages.add(health);
                check(health, thresholds, alerts);
            }
        }

        HealthStatus status = HealthStatus.HEALTHY;
        for (HealthAlert alert : alerts) {
            status = status.worst(alert.level().impact());
        }
        if (status != HealthStatus.HEALTHY) {
            log.warnf("Pipeline health %s with %d alerts", status.label(), alerts.size());
        }
        return new HealthReport(
                new HealthReport.Health(status, now, List.copyOf(alerts), alerts.size(), List.copyOf(stages)),
                thresholds);
    }

    private static void check(StageHealth stage, HealthThresholds thresholds, List<HealthAlert> alerts) {
        String where = stage.queue() + "/" + stage.stage();
        if (stage.p95DurationMs() > thresholds.durationMs()) {
            alerts.add(new HealthAlert(HealthAlert.DURATION, AlertSeverity.WARNING, stage.queue(), stage.stage(),
                    String.format("%s p95 duration %.0fms exceeds %dms", where,
                            stage.p95DurationMs(), thresholds.durationMs()),
                    stage.p95DurationMs(), thresholds.durationMs()));
        }
        if (stage.processed() > 0 && stage.errorRate() > thresholds.errorRate()) {
            alerts.add(new HealthAlert(HealthAlert.ERROR_RATE, AlertSeverity.CRITICAL, stage.queue(), stage.stage(),
                    String.format("%s error rate %.1f%% exceeds %.1f%%", where,
                            stage.errorRate() * 100, thresholds.errorRate() * 100),
                    stage.errorRate(), thresholds.errorRate()));
        }
        if (stage.queueDepth() > thresholds.queueDepth()) {
            alerts.add(new HealthAlert(HealthAlert.QUEUE_DEPTH, AlertSeverity.CRITICAL, stage.queue(), stage.stage(),
                    String.format("%s queue depth %d exceeds %d", where,
                            stage.queueDepth(), thresholds.queueDepth()),
                    stage.queueDepth(), thresholds.queueDepth()));
        }
    }
}
