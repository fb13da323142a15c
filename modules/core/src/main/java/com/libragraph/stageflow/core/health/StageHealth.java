package com.libragraph.stageflow.core.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Metrics of one stage over the evaluation window.
 *
 * @param processed completed plus failed attempts
 */
public record StageHealth(
        @JsonProperty("queue") String queue,
        @JsonProperty("stage") String stage,
        @JsonProperty("processed") long processed,
        @JsonProperty("failures") long failures,
        @JsonProperty("error_rate") double errorRate,
        @JsonProperty("avg_duration_ms") double avgDurationMs,
        @JsonProperty("p95_duration_ms") double p95DurationMs,
        @JsonProperty("queue_depth") long queueDepth,
        @JsonProperty("active_workers") long activeWorkers
) {}
