package com.libragraph.stageflow.core.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.stageflow.types.AlertSeverity;

public record HealthAlert(
        @JsonProperty("type") String type,
        @JsonIgnore AlertSeverity level,
        @JsonProperty("queue") String queue,
        @JsonProperty("stage") String stage,
        @JsonProperty("message") String message,
        @JsonProperty("value") double value,
        @JsonProperty("threshold") double threshold
) {
    public static final String DURATION = "duration";
    public static final String ERROR_RATE = "error_rate";
    public static final String QUEUE_DEPTH = "queue_depth";

    @JsonProperty("severity")
    public String severity() {
        return level.label();
    }

    public boolean critical() {
        return level == AlertSeverity.CRITICAL;
    }
}
