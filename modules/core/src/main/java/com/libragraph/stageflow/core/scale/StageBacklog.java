package com.libragraph.stageflow.core.scale;

/**
 * Pending work for one stage worker.
 *
 * @param backlog       ready plus in-flight messages of the stage
 * @param jobsPerWorker backlog one worker invocation is expected to drain
 */
public record StageBacklog(String workerName, long backlog, int jobsPerWorker) {

    public StageBacklog {
        if (backlog < 0) {
            throw new IllegalArgumentException("backlog must be >= 0, got: " + backlog);
        }
        if (jobsPerWorker <= 0) {
            throw new IllegalArgumentException("jobsPerWorker must be > 0, got: " + jobsPerWorker);
        }
    }
}
