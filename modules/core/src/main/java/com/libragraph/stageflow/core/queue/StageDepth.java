package com.libragraph.stageflow.core.queue;

/**
 * Live message counts for one stage of a queue.
 *
 * @param ready    messages visible now
 * @param inFlight messages currently invisible (leased or delayed)
 */
public record StageDepth(String stage, long ready, long inFlight) {

    public long total() {
        return ready + inFlight;
    }
}
