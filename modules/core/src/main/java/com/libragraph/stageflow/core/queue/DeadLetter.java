package com.libragraph.stageflow.core.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

public record DeadLetter(
        long msgId,
        String queue,
        UUID jobId,
        String stage,
        JsonNode payload,
        String reason,
        JsonNode error,
        int readCount,
        Instant failedAt
) {}
