package com.libragraph.stageflow.core.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.stageflow.types.ItemStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Job-scoped operations available to a {@link StageHandler} while it holds the lease.
 */
public interface StageContext {

    UUID jobId();

    String queue();

    String stage();

    /** 1-based attempt number of this delivery. */
    int attempt();

    int maxAttempts();

    default boolean lastAttempt() {
        return attempt() >= maxAttempts();
    }

    /** Refreshes the job heartbeat and extends the message lease. */
    void heartbeat();

    /** Upserts this stage's output. */
    void saveOutput(Object output);

    Optional<JsonNode> output(String stage);

    void upsertItem(String itemKey, ItemStatus status);

    /**
     * Moves the job to the pipeline's next stage and enqueues its message.
     *
     * @return false when the job is terminal or no longer at this stage
     * @throws IllegalStateException when this is the last stage
     */
    boolean advance(Object nextPayload);

    /** Moves the job to {@code nextStage} (forward jumps allowed) and enqueues its message. */
    boolean advance(String nextStage, Object nextPayload);

    /** Marks the job COMPLETED with {@code result}. */
    boolean completeJob(Object result);
}
