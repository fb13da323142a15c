package com.libragraph.stageflow.core.stage;

import java.util.UUID;

/**
 * Result of processing one message.
 */
public record StageOutcome(Status status, long msgId, UUID jobId, String stage, String detail) {

    public enum Status {
        /** Malformed message or unknown job; acknowledged. */
        INVALID,
        /** Routed to the stage it names; acknowledged here. */
        FORWARDED,
        /** Job already terminal or past this stage; acknowledged. */
        STALE,
        COMPLETED,
        PENDING,
        REQUEUED,
        DEAD_LETTERED,
        /** Store failure while processing; left for redelivery after the visibility timeout. */
        ABANDONED
    }

    static StageOutcome of(Status status, long msgId, UUID jobId, String stage, String detail) {
        return new StageOutcome(status, msgId, jobId, stage, detail);
    }
}
