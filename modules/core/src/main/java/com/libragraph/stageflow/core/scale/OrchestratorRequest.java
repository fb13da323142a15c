package com.libragraph.stageflow.core.scale;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /orchestrator}. Omitted fields take their defaults.
 *
 * @param pipeline restricts the run to one pipeline; all pipelines when null
 */
public record OrchestratorRequest(
        @JsonProperty("maxWorkers") @JsonAlias("max_workers") Integer maxWorkers,
        @JsonProperty("workersPerStage") @JsonAlias("workers_per_stage") Integer workersPerStage,
        @JsonProperty("durationMinutes") @JsonAlias("duration_minutes") Integer durationMinutes,
        @JsonProperty("pipeline") String pipeline
) {
    public static final int DEFAULT_MAX_WORKERS = 20;
    public static final int DEFAULT_WORKERS_PER_STAGE = 5;
    public static final int DEFAULT_DURATION_MINUTES = 60;

    public static OrchestratorRequest defaults() {
        return new OrchestratorRequest(null, null, null, null);
    }

    public ScalingLimits limits() {
        return new ScalingLimits(
                maxWorkers != null ? maxWorkers : DEFAULT_MAX_WORKERS,
                workersPerStage != null ? workersPerStage : DEFAULT_WORKERS_PER_STAGE);
    }

    public int durationOrDefault() {
        return durationMinutes != null ? durationMinutes : DEFAULT_DURATION_MINUTES;
    }
}
