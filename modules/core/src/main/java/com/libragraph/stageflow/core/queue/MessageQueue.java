package com.libragraph.stageflow.core.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

/**
 * Durable, at-least-once stage queue with lease-based delivery.
 *
 * <p>Each pipeline owns one named queue. A dequeued message stays invisible to other
 * consumers for the visibility timeout; if it is not archived within that window it is
 * delivered again. At most one live message exists per {@code (queue, jobId, stage)}:
 * enqueueing a duplicate is a no-op.
 *
 * <p>Implementations throw {@link QueueException} when the backing store is unavailable.
 */
public interface MessageQueue {

    /**
     * Enqueues a message.
     *
     * @return the new message id, or empty when a live message for the same job and stage exists
     */
    OptionalLong enqueue(String queue, StageMessage message, EnqueueOptions options);

    /**
     * Leases up to {@code batchSize} visible messages, highest priority first, hiding them
     * for {@code visibility}. Concurrent callers never receive the same message.
     */
    List<QueueMessage> dequeueBatch(String queue, Duration visibility, int batchSize);

    /** Acknowledges a message. Returns false when it was already archived. */
    boolean archive(String queue, long msgId);

    /** Pushes the visibility deadline of a live message to now + {@code visibility}. */
    boolean extendVisibility(String queue, long msgId, Duration visibility);

    /**
     * Archives {@code msgId} and enqueues {@code message} in a single step.
     *
     * @return the id of the replacement message, or empty when another live message
     * for the same job and stage already exists
     */
    OptionalLong requeue(String queue, long msgId, StageMessage message, EnqueueOptions options);

    /** Archives the message and records it in the dead-letter store. */
    void deadLetter(String queue, QueueMessage message, String reason, JsonNode error);

    /** Live message counts per stage. */
    List<StageDepth> depth(String queue);

    List<DeadLetter> deadLetters(String queue, int limit);
}
