package com.libragraph.stageflow.core.job;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

/**
 * Event-derived metrics for one stage over a time window.
 *
 * @param completions successful stage attempts
 * @param failures    failed stage attempts
 */
public record StageStats(
        @ColumnName("queue") String queue,
        @ColumnName("stage") String stage,
        @ColumnName("completions") long completions,
        @ColumnName("failures") long failures,
        @ColumnName("avg_duration_ms") double avgDurationMs,
        @ColumnName("p95_duration_ms") double p95DurationMs
) {

    public long attempts() {
        return completions + failures;
    }

    public double errorRate() {
        long attempts = attempts();
        return attempts == 0 ? 0.0 : (double) failures / attempts;
    }
}
