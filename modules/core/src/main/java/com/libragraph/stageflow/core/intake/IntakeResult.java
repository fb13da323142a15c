package com.libragraph.stageflow.core.intake;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.stageflow.core.job.JobRecord;

import java.util.UUID;

/**
 * @param created false when an existing job was returned instead of a new one
 */
public record IntakeResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("job_id") UUID jobId,
        @JsonProperty("stage") String stage,
        @JsonProperty("status") String status,
        @JsonProperty("created") boolean created
) {
    static IntakeResult of(JobRecord job, boolean created) {
        return new IntakeResult(true, job.id(), job.stage(), job.status().label(), created);
    }
}
