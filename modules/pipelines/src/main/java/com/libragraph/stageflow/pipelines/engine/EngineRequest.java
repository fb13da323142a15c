package com.libragraph.stageflow.pipelines.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record EngineRequest(
        @JsonProperty("job_id") UUID jobId,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("payload") JsonNode payload
) {}
