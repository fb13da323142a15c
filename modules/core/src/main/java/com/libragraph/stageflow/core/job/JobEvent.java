package com.libragraph.stageflow.core.job;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit entry for a job. {@code metadata} is raw JSON.
 */
public record JobEvent(
        @ColumnName("job_id") UUID jobId,
        @ColumnName("queue") String queue,
        @ColumnName("stage") String stage,
        @ColumnName("type") EventType type,
        @ColumnName("message") String message,
        @ColumnName("metadata") String metadata,
        @ColumnName("duration_ms") Long durationMs,
        @ColumnName("attempt") Integer attempt,
        @ColumnName("created_at") Instant createdAt
) {
    public JobEvent {
        Objects.requireNonNull(jobId, "jobId cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    public static JobEvent of(JobRecord job, EventType type, String message) {
        return new JobEvent(job.id(), job.queue(), job.stage(), type, message, null, null,
                job.attemptCount(), null);
    }

    public JobEvent withMetadata(String metadataJson) {
        return new JobEvent(jobId, queue, stage, type, message, metadataJson, durationMs, attempt, createdAt);
    }

    public JobEvent withDuration(long millis) {
        return new JobEvent(jobId, queue, stage, type, message, metadata, millis, attempt, createdAt);
    }

    public JobEvent atStage(String stageName) {
        return new JobEvent(jobId, queue, stageName, type, message, metadata, durationMs, attempt, createdAt);
    }
}
