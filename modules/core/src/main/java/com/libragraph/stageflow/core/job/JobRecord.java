package com.libragraph.stageflow.core.job;

import com.libragraph.stageflow.types.JobStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

/**
 * A row of {@code pipeline_job}. JSON columns are carried as raw strings.
 */
public record JobRecord(
        @ColumnName("id") UUID id,
        @ColumnName("queue") String queue,
        @ColumnName("stage") String stage,
        @ColumnName("status") JobStatus status,
        @ColumnName("payload") String payload,
        @ColumnName("attempt_count") int attemptCount,
        @ColumnName("max_attempts") int maxAttempts,
        @ColumnName("retry_delay_seconds") int retryDelaySeconds,
        @ColumnName("priority") int priority,
        @ColumnName("dedup_key") String dedupKey,
        @ColumnName("idempotency_key") String idempotencyKey,
        @ColumnName("heartbeat") Instant heartbeat,
        @ColumnName("locked_by") String lockedBy,
        @ColumnName("lease_expires_at") Instant leaseExpiresAt,
        @ColumnName("result") String result,
        @ColumnName("error") String error,
        @ColumnName("created_at") Instant createdAt,
        @ColumnName("updated_at") Instant updatedAt
) {

    public boolean attemptsExhausted() {
        return attemptCount >= maxAttempts;
    }
}
