package com.libragraph.stageflow.core.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.stageflow.types.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * Body of {@code /healthcheck}.
 */
public record HealthReport(
        @JsonProperty("health") Health health,
        @JsonProperty("thresholds") HealthThresholds thresholds
) {
    public record Health(
            @JsonIgnore HealthStatus overall,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("alerts") List<HealthAlert> alerts,
            @JsonProperty("alert_count") int alertCount,
            @JsonProperty("stages") List<StageHealth> stages
    ) {
        @JsonProperty("status")
        public String status() {
            return overall.label();
        }
    }

    @JsonIgnore
    public HealthStatus status() {
        return health.overall();
    }

    /** 503 when unhealthy, 200 otherwise. */
    @JsonIgnore
    public int httpStatus() {
        return health.overall() == HealthStatus.UNHEALTHY ? 503 : 200;
    }

    public boolean hasCriticalAlert() {
        return health.alerts().stream().anyMatch(HealthAlert::critical);
    }
}
