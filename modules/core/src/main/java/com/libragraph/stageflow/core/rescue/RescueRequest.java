package com.libragraph.stageflow.core.rescue;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /bulk-rescue}.
 *
 * @param jobType       pipeline whose stale jobs are resumed
 * @param minAgeMinutes a job is stale when its heartbeat is older than this; defaults to 30
 * @param maxJobs       upper bound on jobs resumed by one call; defaults to 10
 */
public record RescueRequest(
        @JsonProperty("job_type") String jobType,
        @JsonProperty("min_age_minutes") Integer minAgeMinutes,
        @JsonProperty("max_jobs") Integer maxJobs
) {
    public static final int DEFAULT_MIN_AGE_MINUTES = 30;
    public static final int DEFAULT_MAX_JOBS = 10;

    public int minAgeOrDefault() {
        return minAgeMinutes != null ? minAgeMinutes : DEFAULT_MIN_AGE_MINUTES;
    }

    public int maxJobsOrDefault() {
        return maxJobs != null ? maxJobs : DEFAULT_MAX_JOBS;
    }
}
