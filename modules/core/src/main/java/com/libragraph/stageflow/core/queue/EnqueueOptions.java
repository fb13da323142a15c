package com.libragraph.stageflow.core.queue;

import java.time.Duration;
import java.util.Objects;

public record EnqueueOptions(int priority, Duration delay) {

    private static final EnqueueOptions DEFAULTS = new EnqueueOptions(0, Duration.ZERO);

    public EnqueueOptions {
        Objects.requireNonNull(delay, "delay cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0, got: " + delay);
        }
    }

    public static EnqueueOptions defaults() {
        return DEFAULTS;
    }

    public static EnqueueOptions priority(int priority) {
        return new EnqueueOptions(priority, Duration.ZERO);
    }

    public EnqueueOptions withDelay(Duration delay) {
        return new EnqueueOptions(priority, delay);
    }
}
