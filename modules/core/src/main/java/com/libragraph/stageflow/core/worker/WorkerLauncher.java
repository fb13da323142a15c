package com.libragraph.stageflow.core.worker;

/**
 * Starts one stage worker invocation asynchronously.
 */
public interface WorkerLauncher {

    /**
     * @return false when the launch was rejected (pool saturated or shutting down)
     */
    boolean launch(String workerName);
}
