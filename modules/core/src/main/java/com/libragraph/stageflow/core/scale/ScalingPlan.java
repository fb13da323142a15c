package com.libragraph.stageflow.core.scale;

import java.util.List;

/**
 * Workers to launch this cycle.
 *
 * @param availableSlots {@code maxWorkers} minus workers already active, never negative
 * @param scale          fraction of the ideal launched, 1.0 when slots suffice
 */
public record ScalingPlan(List<Launch> launches, int idealTotal, int availableSlots, double scale) {

    public record Launch(String workerName, long backlog, int ideal, int count) {}

    public int total() {
        int total = 0;
        for (Launch l : launches) {
            total += l.count();
        }
        return total;
    }
}
