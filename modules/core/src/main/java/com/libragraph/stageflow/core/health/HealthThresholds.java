package com.libragraph.stageflow.core.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Alert thresholds. A stage alerts when its p95 duration, error rate or queue depth
 * is strictly above the threshold.
 */
public record HealthThresholds(
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("error_rate") double errorRate,
        @JsonProperty("queue_depth") long queueDepth
) {
    public static final HealthThresholds DEFAULTS = new HealthThresholds(300_000, 0.1, 100);

    public HealthThresholds {
        if (durationMs <= 0) {
            throw new IllegalArgumentException("duration threshold must be > 0, got: " + durationMs);
        }
        if (errorRate < 0 || errorRate > 1) {
            throw new IllegalArgumentException("error rate threshold must be within [0, 1], got: " + errorRate);
        }
        if (queueDepth < 0) {
            throw new IllegalArgumentException("queue depth threshold must be >= 0, got: " + queueDepth);
        }
    }

    /** Defaults overridden by whichever values are non-null. */
    public static HealthThresholds of(Long durationMs, Double errorRate, Long queueDepth) {
        return new HealthThresholds(
                durationMs != null ? durationMs : DEFAULTS.durationMs,
                errorRate != null ? errorRate : DEFAULTS.errorRate,
                queueDepth != null ? queueDepth : DEFAULTS.queueDepth);
    }
}
