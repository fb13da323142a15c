package com.libragraph.stageflow.core.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.UUID;

/**
 * Body of a queue message: the job, the stage it targets and the stage input.
 * {@code jobId} may be null for malformed messages read back from the queue.
 */
public record StageMessage(UUID jobId, String stage, JsonNode payload) {

    public StageMessage {
        Objects.requireNonNull(stage, "stage cannot be null");
    }
}
