package com.libragraph.stageflow.core.worker;

/**
 * Outcome of a worker trigger: whether a batch was leased and handed off.
 */
public record TriggerResult(String worker, Status status, int count) {

    public enum Status {
        ACCEPTED,
        EMPTY
    }

    public static TriggerResult accepted(String worker, int count) {
        return new TriggerResult(worker, Status.ACCEPTED, count);
    }

    public static TriggerResult empty(String worker) {
        return new TriggerResult(worker, Status.EMPTY, 0);
    }
}
