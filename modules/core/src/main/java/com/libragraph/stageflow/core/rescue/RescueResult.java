package com.libragraph.stageflow.core.rescue;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record RescueResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("message") String message,
        @JsonProperty("data") Data data,
        @JsonProperty("timestamp") Instant timestamp
) {
    public record Data(
            @JsonProperty("job_type") String jobType,
            @JsonProperty("rescued_jobs") int rescuedJobs,
            @JsonProperty("job_ids") List<UUID> jobIds
    ) {}

    public int rescuedJobs() {
        return data.rescuedJobs();
    }
}
