package com.libragraph.stageflow.core.job;

import java.util.Objects;
import java.util.UUID;

/**
 * Insert request for a job entering its first stage.
 *
 * @param dedupKey       natural key; at most one active job per queue carries it
 * @param idempotencyKey caller-supplied key; at most one job per queue carries it, ever
 */
public record NewJob(
        UUID id,
        String queue,
        String stage,
        String payload,
        int priority,
        int maxAttempts,
        int retryDelaySeconds,
        String dedupKey,
        String idempotencyKey
) {
    public NewJob {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(queue, "queue cannot be null");
        Objects.requireNonNull(stage, "stage cannot be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
        }
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("retryDelaySeconds must be >= 0, got: " + retryDelaySeconds);
        }
    }
}
