package com.libragraph.stageflow.core.stage;

import java.time.Duration;
import java.util.Objects;

/**
 * What a handler reports back to the runner.
 *
 * @param done         the stage's own work is done
 * @param recheckAfter when non-null, the runner redelivers the same stage after this delay
 */
public record StageResult(boolean done, Duration recheckAfter) {

    private static final StageResult COMPLETE = new StageResult(true, null);
    private static final StageResult PENDING = new StageResult(false, null);

    public static StageResult complete() {
        return COMPLETE;
    }

    /** The handler scheduled its own continuation; the message is acknowledged. */
    public static StageResult pending() {
        return PENDING;
    }

    /** Redeliver this stage after {@code delay}. Each redelivery consumes an attempt. */
    public static StageResult recheckAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay cannot be null");
        return new StageResult(false, delay);
    }
}
