package com.libragraph.stageflow.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Redelivery delay for a failed stage attempt.
 *
 * <p>The delay grows linearly with the attempt number: {@code max(base, 1s) * max(attempt, 1)},
 * capped at {@link #cap()}. Attempt numbers are 1-based; anything below 1 is treated as 1.
 */
public record Backoff(Duration base, Duration cap) {

    public static final Duration MIN_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CAP = Duration.ofHours(1);

    public Backoff {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(cap, "cap cannot be null");
        if (base.isNegative()) {
            throw new IllegalArgumentException("base must be >= 0, got: " + base);
        }
        if (cap.compareTo(MIN_DELAY) < 0) {
            throw new IllegalArgumentException("cap must be >= 1s, got: " + cap);
        }
    }

    /**
     * Backoff from a retry delay in seconds with the default one hour cap.
     */
    public static Backoff ofSeconds(long baseSeconds) {
        return new Backoff(Duration.ofSeconds(baseSeconds), DEFAULT_CAP);
    }

    /**
     * Doubling delay {@code base * 2^(attempt - 1)} capped at {@code cap}, for short in-process
     * retries. No minimum applies to {@code base}.
     */
    public static Duration exponential(Duration base, Duration cap, int attempt) {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(cap, "cap cannot be null");
        int shift = Math.min(Math.max(attempt, 1) - 1, 30);
        long baseMillis = Math.max(base.toMillis(), 0);
        long capMillis = cap.toMillis();
        if (baseMillis > capMillis >> shift) {
            return cap;
        }
        return Duration.ofMillis(baseMillis << shift);
    }

    public Duration delayFor(int attempt) {
        Duration step = base.compareTo(MIN_DELAY) < 0 ? MIN_DELAY : base;
        long multiplier = Math.max(attempt, 1);
        if (step.getSeconds() > cap.getSeconds() / multiplier) {
            return cap;
        }
        Duration delay = step.multipliedBy(multiplier);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
