package com.libragraph.stageflow.core.worker;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class BackgroundTaskSupervisorTest {

    @Test
    void submit_tracksTaskUntilItFinishes() throws Exception {
        BackgroundTaskSupervisor supervisor = new BackgroundTaskSupervisor(1, 5);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            supervisor.submit("batch-1", () -> {
                started.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(supervisor.inFlight()).containsExactly("batch-1");

            release.countDown();
            long deadline = System.currentTimeMillis() + 5000;
            while (!supervisor.inFlight().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(supervisor.inFlight()).isEmpty();
        } finally {
            supervisor.shutdown();
        }
    }

    @Test
    void submit_failingTaskDoesNotStopLaterTasks() throws Exception {
        BackgroundTaskSupervisor supervisor = new BackgroundTaskSupervisor(1, 5);
        AtomicBoolean ran = new AtomicBoolean();
        CountDownLatch done = new CountDownLatch(1);
        try {
            supervisor.submit("bad", () -> {
                throw new IllegalStateException("boom");
            });
            supervisor.submit("good", () -> {
                ran.set(true);
                done.countDown();
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(ran).isTrue();
        } finally {
            supervisor.shutdown();
        }
    }

    @Test
    void shutdown_waitsForRunningTasks() {
        BackgroundTaskSupervisor supervisor = new BackgroundTaskSupervisor(1, 5);
        AtomicBoolean finished = new AtomicBoolean();
        supervisor.submit("slow", () -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            finished.set(true);
        });

        supervisor.shutdown();

        assertThat(finished).isTrue();
    }
}
