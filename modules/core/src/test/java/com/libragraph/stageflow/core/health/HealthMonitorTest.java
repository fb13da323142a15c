package com.libragraph.stageflow.core.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.testing.PipelineHarness;
import com.libragraph.stageflow.core.testing.TestPipeline;
import com.libragraph.stageflow.types.AlertSeverity;
import com.libragraph.stageflow.types.HealthStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthMonitorTest {

    PipelineHarness h;
    HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        h = new PipelineHarness();
        h.register(new TestPipeline("content", "research", "draft"));
        monitor = new HealthMonitor();
        monitor.registry = h.registry;
        monitor.store = h.store;
        monitor.queue = h.queue;
        monitor.clock = h.clock;
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void evaluate_idlePipelineIsHealthy() {
        HealthReport report = monitor.evaluate(HealthThresholds.DEFAULTS);

        assertThat(report.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(report.httpStatus()).isEqualTo(200);
        assertThat(report.health().alerts()).isEmpty();
        assertThat(report.health().stages()).extracting(StageHealth::stage).containsExactly("research", "draft");
    }

    @Test
    void evaluate_deepQueueIsUnhealthy() {
        for (int i = 0; i < 150; i++) {
            h.submit("content", "research");
        }

        HealthReport report = monitor.evaluate(HealthThresholds.DEFAULTS);

        assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(report.httpStatus()).isEqualTo(503);
        assertThat(report.hasCriticalAlert()).isTrue();
        assertThat(report.health().alerts()).singleElement().satisfies(alert -> {
            assertThat(alert.type()).isEqualTo(HealthAlert.QUEUE_DEPTH);
            assertThat(alert.stage()).isEqualTo("research");
            assertThat(alert.value()).isEqualTo(150.0);
            assertThat(alert.threshold()).isEqualTo(100.0);
        });
    }

    @Test
    void evaluate_depthAtThresholdDoesNotAlert() {
        for (int i = 0; i < 5; i++) {
            h.submit("content", "research");
        }

        assertThat(monitor.evaluate(HealthThresholds.of(null, null, 5L)).health().alerts()).isEmpty();
        assertThat(monitor.evaluate(HealthThresholds.of(null, null, 4L)).health().alerts()).hasSize(1);
    }

    @Test
    void evaluate_slowStageOnlyDegrades() {
        JobRecord job = h.submit("content", "draft");
        h.store.appendEvent(JobEvent.of(job, EventType.STAGE_COMPLETED, "slow").withDuration(400_000));

        HealthReport report = monitor.evaluate(HealthThresholds.DEFAULTS);

        assertThat(report.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(report.httpStatus()).isEqualTo(200);
        assertThat(report.health().alerts()).singleElement().satisfies(alert -> {
            assertThat(alert.type()).isEqualTo(HealthAlert.DURATION);
            assertThat(alert.level()).isEqualTo(AlertSeverity.WARNING);
        });
    }

    @Test
    void evaluate_highErrorRateIsCritical() {
        JobRecord job = h.submit("content", "research");
        h.store.appendEvent(JobEvent.of(job, EventType.STAGE_COMPLETED, "ok").withDuration(10));
        h.store.appendEvent(JobEvent.of(job, EventType.ERROR, "boom").withDuration(10));

        HealthReport report = monitor.evaluate(HealthThresholds.DEFAULTS);

        assertThat(report.status()).isEqualTo(HealthStatus.UNHEALTHY);
        StageHealth research = report.health().stages().get(0);
        assertThat(research.processed()).isEqualTo(2);
        assertThat(research.failures()).isEqualTo(1);
        assertThat(research.errorRate()).isEqualTo(0.5);
        assertThat(report.health().alerts()).extracting(HealthAlert::type).containsExactly(HealthAlert.ERROR_RATE);
    }

    @Test
    void evaluate_oldEventsFallOutsideWindow() {
        JobRecord job = h.submit("content", "research");
        h.store.appendEvent(JobEvent.of(job, EventType.ERROR, "boom").withDuration(10));
        h.clock.advance(Duration.ofHours(2));

        assertThat(monitor.evaluate(HealthThresholds.DEFAULTS).status()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void evaluate_realRunFeedsMetrics() {
        h.submit("content", "research");
        h.runWorker("content-research");

        StageHealth research = monitor.evaluate(HealthThresholds.DEFAULTS).health().stages().get(0);

        assertThat(research.processed()).isEqualTo(1);
        assertThat(research.failures()).isZero();
    }

    @Test
    void report_serializesLabels() throws Exception {
        for (int i = 0; i < 3; i++) {
            h.submit("content", "research");
        }
        HealthReport report = monitor.evaluate(HealthThresholds.of(null, null, 2L));
        ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(report));

        assertThat(json.at("/health/status").asText()).isEqualTo("unhealthy");
        assertThat(json.at("/health/alert_count").asInt()).isEqualTo(1);
        assertThat(json.at("/health/alerts/0/severity").asText()).isEqualTo("critical");
        assertThat(json.at("/health/alerts/0").has("level")).isFalse();
        assertThat(json.at("/health").has("overall")).isFalse();
        assertThat(json.at("/health/stages/0/queue_depth").asLong()).isEqualTo(3);
        assertThat(json.at("/thresholds/queue_depth").asLong()).isEqualTo(2);
    }

    @Test
    void thresholds_validated() {
        assertThatThrownBy(() -> HealthThresholds.of(0L, null, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HealthThresholds.of(null, 1.5, null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HealthThresholds.of(null, null, -1L)).isInstanceOf(IllegalArgumentException.class);
        assertThat(HealthThresholds.of(null, null, null)).isEqualTo(HealthThresholds.DEFAULTS);
    }
}
