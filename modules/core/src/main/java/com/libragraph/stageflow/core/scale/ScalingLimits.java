package com.libragraph.stageflow.core.scale;

/**
 * @param maxWorkers      ceiling on concurrently running workers across all stages
 * @param workersPerStage ceiling on workers launched for one stage in one cycle
 */
public record ScalingLimits(int maxWorkers, int workersPerStage) {

    public ScalingLimits {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be > 0, got: " + maxWorkers);
        }
        if (workersPerStage <= 0) {
            throw new IllegalArgumentException("workersPerStage must be > 0, got: " + workersPerStage);
        }
    }
}
