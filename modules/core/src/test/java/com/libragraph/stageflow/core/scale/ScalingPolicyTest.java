package com.libragraph.stageflow.core.scale;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScalingPolicyTest {

    static final ScalingLimits LIMITS = new ScalingLimits(20, 5);

    @Test
    void plan_launchesIdealWhenSlotsSuffice() {
        ScalingPlan plan = ScalingPolicy.plan(List.of(
                new StageBacklog("content-research", 25, 10),
                new StageBacklog("content-outline", 0, 10),
                new StageBacklog("content-draft", 7, 5)), 0, LIMITS);

        assertThat(plan.launches()).extracting(ScalingPlan.Launch::count).containsExactly(3, 0, 2);
        assertThat(plan.idealTotal()).isEqualTo(5);
        assertThat(plan.availableSlots()).isEqualTo(20);
        assertThat(plan.scale()).isEqualTo(1.0);
    }

    @Test
    void plan_capsEachStageAtWorkersPerStage() {
        ScalingPlan plan = ScalingPolicy.plan(List.of(new StageBacklog("content-draft", 1000, 10)), 0, LIMITS);

        assertThat(plan.launches().get(0).ideal()).isEqualTo(5);
        assertThat(plan.total()).isEqualTo(5);
    }

    @Test
    void plan_scalesDownAndFillsSlotsExactly() {
        ScalingPlan plan = ScalingPolicy.plan(List.of(
                new StageBacklog("a", 50, 10),
                new StageBacklog("b", 50, 10),
                new StageBacklog("c", 50, 10)), 0, new ScalingLimits(10, 5));

        assertThat(plan.idealTotal()).isEqualTo(15);
        assertThat(plan.launches()).extracting(ScalingPlan.Launch::count).containsExactly(4, 3, 3);
        assertThat(plan.total()).isEqualTo(10);
        assertThat(plan.scale()).isEqualTo(10.0 / 15);
    }

    @Test
    void plan_activeWorkersUseUpSlots() {
        List<StageBacklog> stages = List.of(new StageBacklog("a", 100, 10), new StageBacklog("b", 10, 10));

        ScalingPlan partial = ScalingPolicy.plan(stages, 17, LIMITS);
        assertThat(partial.availableSlots()).isEqualTo(3);
        assertThat(partial.total()).isEqualTo(3);

        ScalingPlan none = ScalingPolicy.plan(stages, 25, LIMITS);
        assertThat(none.availableSlots()).isZero();
        assertThat(none.total()).isZero();
    }

    @Test
    void plan_neverExceedsIdealOrSlots() {
        Random random = new Random(42);
        for (int round = 0; round < 500; round++) {
            int n = 1 + random.nextInt(6);
            StageBacklog[] stages = new StageBacklog[n];
            for (int i = 0; i < n; i++) {
                stages[i] = new StageBacklog("s" + i, random.nextInt(200), 1 + random.nextInt(20));
            }
            ScalingLimits limits = new ScalingLimits(1 + random.nextInt(30), 1 + random.nextInt(8));
            int active = random.nextInt(10);

            ScalingPlan plan = ScalingPolicy.plan(List.of(stages), active, limits);

            assertThat(plan.total()).isEqualTo(Math.min(plan.idealTotal(), plan.availableSlots()));
            assertThat(plan.launches()).allSatisfy(l -> assertThat(l.count()).isBetween(0, l.ideal()));
        }
    }

    @Test
    void inputs_validated() {
        assertThatThrownBy(() -> new StageBacklog("a", -1, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StageBacklog("a", 1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScalingLimits(0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScalingLimits(5, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
