package com.libragraph.stageflow.core.scale;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record OrchestratorSummary(
        @JsonProperty("orchestratorId") String orchestratorId,
        @JsonProperty("startTime") Instant startTime,
        @JsonProperty("endTime") Instant endTime,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("cycles") int cycles,
        @JsonProperty("workersLaunched") int workersLaunched,
        @JsonProperty("stageStats") Map<String, WorkerStats> stageStats,
        @JsonProperty("errors") int errors
) {
    /**
     * @param lastBacklog backlog observed in the most recent cycle
     * @param launched    workers launched over the whole run
     */
    public record WorkerStats(
            @JsonProperty("lastBacklog") long lastBacklog,
            @JsonProperty("launched") int launched
    ) {}
}
