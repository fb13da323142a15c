package com.libragraph.stageflow.core.job;

public enum EventType {
    QUEUED,
    PROCESSING,
    STAGE_COMPLETED,
    PENDING,
    ERROR,
    REQUEUED,
    FORWARDED,
    DEAD_LETTERED,
    FAILED,
    COMPLETED,
    RESCUED;

    public String label() {
        return name().toLowerCase();
    }
}
