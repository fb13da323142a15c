package com.libragraph.stageflow.core.config;

import java.time.Duration;

/**
 * Immutable per-pipeline queue and retry settings, resolved once from configuration.
 *
 * @param visibility    how long a dequeued message stays hidden from other consumers
 * @param batchSize     messages leased per worker trigger
 * @param maxAttempts   attempts per stage before the job fails
 * @param retryDelay    base delay before a failed stage is redelivered
 */
public record QueueSettings(Duration visibility, int batchSize, int maxAttempts, Duration retryDelay) {

    public static final QueueSettings DEFAULTS =
            new QueueSettings(Duration.ofSeconds(600), 10, 5, Duration.ofSeconds(60));

    public QueueSettings {
        if (visibility == null || visibility.compareTo(Duration.ofSeconds(1)) < 0) {
            throw new IllegalArgumentException("visibility must be >= 1s, got: " + visibility);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0, got: " + retryDelay);
        }
    }

    /** Interval at which a lease-holder refreshes its heartbeat: a third of the visibility window. */
    public Duration heartbeatInterval() {
        return visibility.dividedBy(3);
    }
}
