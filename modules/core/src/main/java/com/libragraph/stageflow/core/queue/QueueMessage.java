package com.libragraph.stageflow.core.queue;

import java.time.Instant;

/**
 * A leased or enqueued message with its delivery metadata.
 *
 * @param visibleAt instant the message becomes visible to other consumers again
 * @param readCount number of times the message has been dequeued
 */
public record QueueMessage(
        long msgId,
        String queue,
        StageMessage body,
        int priority,
        int readCount,
        Instant enqueuedAt,
        Instant visibleAt
) {}
