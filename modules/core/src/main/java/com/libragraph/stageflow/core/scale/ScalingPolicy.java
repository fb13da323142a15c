package com.libragraph.stageflow.core.scale;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Load-proportional worker allocation.
 *
 * <p>Each stage ideally gets {@code ceil(backlog / jobsPerWorker)} workers, capped at
 * {@code workersPerStage}. When the ideal total exceeds the free slots, every stage is
 * scaled down by the same factor and the rounding remainder is handed out by largest
 * fractional part (earlier stages win ties), so the plan fills the free slots exactly
 * and no stage ever exceeds its ideal.
 */
public final class ScalingPolicy {

    private ScalingPolicy() {
    }

    public static ScalingPlan plan(List<StageBacklog> stages, int activeWorkers, ScalingLimits limits) {
        int n = stages.size();
        int[] ideal = new int[n];
        int idealTotal = 0;
        for (int i = 0; i < n; i++) {
            StageBacklog s = stages.get(i);
            long needed = (s.backlog() + s.jobsPerWorker() - 1) / s.jobsPerWorker();
            ideal[i] = (int) Math.min(needed, limits.workersPerStage());
            idealTotal += ideal[i];
        }

        int slots = Math.max(0, limits.maxWorkers() - Math.max(0, activeWorkers));
        int[] count = new int[n];
        double scale;
        if (idealTotal <= slots) {
            System.arraycopy(ideal, 0, count, 0, n);
            scale = 1.0;
        } else {
            scale = (double) slots / idealTotal;
            long[] remainder = new long[n];
            int assigned = 0;
            for (int i = 0; i < n; i++) {
                long share = (long) ideal[i] * slots;
                count[i] = (int) (share / idealTotal);
                remainder[i] = share % idealTotal;
                assigned += count[i];
            }
            List<Integer> order = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingLong((Integer i) -> remainder[i]).reversed()
                    .thenComparingInt(i -> i));
            for (int k = 0; k < slots - assigned; k++) {
                count[order.get(k)]++;
            }
        }

        List<ScalingPlan.Launch> launches = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            StageBacklog s = stages.get(i);
            launches.add(new ScalingPlan.Launch(s.workerName(), s.backlog(), ideal[i], count[i]));
        }
        return new ScalingPlan(List.copyOf(launches), idealTotal, slots, scale);
    }
}
