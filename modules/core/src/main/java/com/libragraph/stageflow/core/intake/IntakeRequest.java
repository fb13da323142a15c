package com.libragraph.stageflow.core.intake;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of {@code POST /jobs/{pipeline}}. Everything except {@code payload} is optional.
 */
public record IntakeRequest(
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("max_attempts") Integer maxAttempts,
        @JsonProperty("retry_delay_seconds") Integer retryDelaySeconds,
        @JsonProperty("idempotency_key") String idempotencyKey
) {
    public static IntakeRequest of(JsonNode payload) {
        return new IntakeRequest(payload, null, null, null, null);
    }
}
