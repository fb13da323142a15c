package com.libragraph.stageflow.core.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.stageflow.core.config.QueueSettings;
import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.queue.DeadLetter;
import com.libragraph.stageflow.core.queue.EnqueueOptions;
import com.libragraph.stageflow.core.queue.StageDepth;
import com.libragraph.stageflow.core.queue.StageMessage;
import com.libragraph.stageflow.core.stage.StageOutcome.Status;
import com.libragraph.stageflow.core.testing.PipelineHarness;
import com.libragraph.stageflow.core.testing.TestPipeline;
import com.libragraph.stageflow.types.ItemStatus;
import com.libragraph.stageflow.types.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class StageRunnerTest {

    PipelineHarness h;
    TestPipeline pipeline;

    @BeforeEach
    void setUp() {
        h = new PipelineHarness();
        pipeline = new TestPipeline("demo", "a", "b");
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void processBatch_advancesThroughStagesAndCompletes() {
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.COMPLETED);
        JobRecord afterA = h.job(job.id());
        assertThat(afterA.stage()).isEqualTo("b");
        assertThat(afterA.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(afterA.attemptCount()).isZero();
        assertThat(afterA.lockedBy()).isNull();

        assertThat(h.runWorker("demo-b")).extracting(StageOutcome::status).containsExactly(Status.COMPLETED);
        assertThat(h.job(job.id()).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(h.queue.depth("demo")).isEmpty();
        assertThat(h.store.events(job.id())).extracting(JobEvent::type).containsSubsequence(
                EventType.PROCESSING, EventType.QUEUED, EventType.STAGE_COMPLETED,
                EventType.PROCESSING, EventType.COMPLETED, EventType.STAGE_COMPLETED);
    }

    @Test
    void processBatch_transientFailureUsesAllAttemptsThenFails() {
        pipeline.on("a", (id, payload, ctx) -> {
            throw new IOException("engine unreachable");
        });
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a", 3, 0);

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.REQUEUED);
        assertThat(h.job(job.id()).status()).isEqualTo(JobStatus.QUEUED);

        // Backoff is 1s after the first attempt and 2s after the second
        h.clock.advance(Duration.ofSeconds(1));
        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.REQUEUED);
        h.clock.advance(Duration.ofSeconds(2));
        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.DEAD_LETTERED);

        JobRecord failed = h.job(job.id());
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.attemptCount()).isEqualTo(3);
        assertThat(failed.error()).contains("engine unreachable");
        assertThat(pipeline.calls("a")).isEqualTo(3);
        assertThat(h.queue.deadLetters("demo", 10)).extracting(DeadLetter::reason)
                .containsExactly("max_attempts_exceeded");
        assertThat(h.queue.depth("demo")).isEmpty();
    }

    @Test
    void processBatch_retryIsNotVisibleBeforeBackoff() {
        pipeline.on("a", (id, payload, ctx) -> {
            throw new RetryableStageException("rate limited");
        });
        h.register(pipeline);
        h.submit("demo", "a", 5, 10);

        h.runWorker("demo-a");

        h.clock.advance(Duration.ofSeconds(9));
        assertThat(h.runWorker("demo-a")).isEmpty();
        h.clock.advance(Duration.ofSeconds(1));
        assertThat(h.runWorker("demo-a")).hasSize(1);
    }

    @Test
    void processBatch_fatalErrorFailsWithoutRetry() {
        pipeline.on("a", (id, payload, ctx) -> {
            throw new FatalStageException("bad input");
        });
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).extracting(StageOutcome::status).containsExactly(Status.DEAD_LETTERED);
        assertThat(outcomes.get(0).detail()).isEqualTo("fatal_error");
        JobRecord failed = h.job(job.id());
        assertThat(failed.status()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.attemptCount()).isEqualTo(1);
        assertThat(h.store.events(job.id())).extracting(JobEvent::type)
                .contains(EventType.ERROR, EventType.DEAD_LETTERED);
    }

    @Test
    void processBatch_messageForAnotherStageIsForwardedNotHandled() {
        h.register(pipeline);
        JobRecord job = h.submit("demo", "b");

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).extracting(StageOutcome::status).containsExactly(Status.FORWARDED);
        assertThat(pipeline.calls("a")).isZero();
        assertThat(pipeline.calls("b")).isZero();
        assertThat(h.queue.depth("demo")).extracting(StageDepth::stage, StageDepth::total)
                .containsExactly(tuple("b", 1L));

        assertThat(h.runWorker("demo-b")).extracting(StageOutcome::status).containsExactly(Status.COMPLETED);
        assertThat(h.job(job.id()).status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void processBatch_messageWithoutJobIdIsArchivedAsInvalid() {
        h.register(pipeline);
        h.queue.enqueue("demo", new StageMessage(null, "a", null), EnqueueOptions.defaults());

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.INVALID);
        assertThat(h.queue.depth("demo")).isEmpty();
        assertThat(pipeline.calls("a")).isZero();
    }

    @Test
    void processBatch_messageForUnknownJobIsInvalid() {
        h.register(pipeline);
        h.queue.enqueue("demo", new StageMessage(UUID.randomUUID(), "a", null), EnqueueOptions.defaults());

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.INVALID);
        assertThat(h.queue.depth("demo")).isEmpty();
    }

    @Test
    void processBatch_messageForTerminalJobIsStale() {
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");
        h.store.fail(job.id(), "a", "{\"message\":\"cancelled\"}");

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.STALE);
        assertThat(pipeline.calls("a")).isZero();
        assertThat(h.queue.depth("demo")).isEmpty();
    }

    @Test
    void processBatch_redeliveryAfterAttemptsExhaustedDeadLetters() {
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a", 1, 60);
        // A worker leased the job and died without recording the outcome
        h.store.startStage(job.id(), "a", "dead-worker", Duration.ofMinutes(10));
        h.queue.dequeueBatch("demo", h.visibility("demo-a"), 10);
        h.clock.advance(h.visibility("demo-a"));

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).extracting(StageOutcome::status).containsExactly(Status.DEAD_LETTERED);
        assertThat(outcomes.get(0).detail()).isEqualTo("max_attempts_exceeded");
        assertThat(h.job(job.id()).status()).isEqualTo(JobStatus.FAILED);
        assertThat(pipeline.calls("a")).isZero();
    }

    @Test
    void processBatch_oneFailureDoesNotAffectSiblings() {
        h.register(pipeline);
        JobRecord ok1 = h.submit("demo", "a");
        JobRecord bad = h.submit("demo", "a");
        JobRecord ok2 = h.submit("demo", "a");
        pipeline.on("a", (id, payload, ctx) -> {
            if (id.equals(bad.id())) {
                throw new IllegalStateException("boom");
            }
            ctx.advance(payload);
            return StageResult.complete();
        });

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes).filteredOn(o -> o.jobId().equals(bad.id()))
                .extracting(StageOutcome::status).containsExactly(Status.REQUEUED);
        assertThat(outcomes).filteredOn(o -> Set.of(ok1.id(), ok2.id()).contains(o.jobId()))
                .extracting(StageOutcome::status).containsOnly(Status.COMPLETED);
        assertThat(h.job(ok1.id()).stage()).isEqualTo("b");
        assertThat(h.job(ok2.id()).stage()).isEqualTo("b");
        assertThat(h.job(bad.id()).stage()).isEqualTo("a");
    }

    @Test
    void processBatch_errorThrownByHandlerIsRecordedWithoutBreakingTheBatch() {
        h.register(pipeline);
        JobRecord ok = h.submit("demo", "a");
        JobRecord bad = h.submit("demo", "a");
        pipeline.on("a", (id, payload, ctx) -> {
            if (id.equals(bad.id())) {
                throw new AssertionError("handler invariant broken");
            }
            ctx.advance(payload);
            return StageResult.complete();
        });

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).hasSize(2);
        assertThat(outcomes).filteredOn(o -> o.jobId().equals(bad.id()))
                .extracting(StageOutcome::status).containsExactly(Status.REQUEUED);
        assertThat(outcomes).filteredOn(o -> o.jobId().equals(ok.id()))
                .extracting(StageOutcome::status).containsExactly(Status.COMPLETED);
        JobRecord failed = h.job(bad.id());
        assertThat(failed.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(failed.lockedBy()).isNull();
        assertThat(failed.error()).contains(AssertionError.class.getName());
    }

    @Test
    void processBatch_jobLeasedByAnotherWorkerIsLeftForRedelivery() {
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a", 1, 60);
        h.store.startStage(job.id(), "a", "other-worker", Duration.ofMinutes(10));

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).extracting(StageOutcome::status).containsExactly(Status.ABANDONED);
        assertThat(outcomes.get(0).detail()).isEqualTo("lease_conflict");
        assertThat(pipeline.calls("a")).isZero();
        JobRecord current = h.job(job.id());
        assertThat(current.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(current.lockedBy()).isEqualTo("other-worker");
        assertThat(current.attemptCount()).isEqualTo(1);
        assertThat(h.queue.depth("demo")).extracting(StageDepth::stage, StageDepth::total)
                .containsExactly(tuple("a", 1L));
    }

    @Test
    void processBatch_retryableFailureIsRetriedInProcessBeforeUsingAnAttempt() {
        List<Duration> sleeps = new CopyOnWriteArrayList<>();
        h.runner.handlerMaxTries = 3;
        h.runner.sleeper = sleeps::add;
        AtomicInteger tries = new AtomicInteger();
        pipeline.on("a", (id, payload, ctx) -> {
            if (tries.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
            ctx.advance(payload);
            return StageResult.complete();
        });
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.COMPLETED);

        assertThat(pipeline.calls("a")).isEqualTo(3);
        assertThat(h.job(job.id()).stage()).isEqualTo("b");
        assertThat(h.store.events(job.id())).extracting(JobEvent::type).doesNotContain(EventType.ERROR);
        // 250ms then 500ms, each within 25% jitter
        assertThat(sleeps).hasSize(2);
        assertThat(sleeps.get(0).toMillis()).isBetween(187L, 313L);
        assertThat(sleeps.get(1).toMillis()).isBetween(375L, 625L);
    }

    @Test
    void processBatch_inProcessRetriesExhaustedFallBackToRequeue() {
        h.runner.handlerMaxTries = 2;
        h.runner.sleeper = d -> { };
        pipeline.on("a", (id, payload, ctx) -> {
            throw new RetryableStageException("upstream busy");
        });
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a", 5, 0);

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.REQUEUED);

        assertThat(pipeline.calls("a")).isEqualTo(2);
        assertThat(h.job(job.id()).attemptCount()).isEqualTo(1);
    }

    @Test
    void processBatch_fatalFailureIsNotRetriedInProcess() {
        List<Duration> sleeps = new CopyOnWriteArrayList<>();
        h.runner.handlerMaxTries = 3;
        h.runner.sleeper = sleeps::add;
        pipeline.on("a", (id, payload, ctx) -> {
            throw new FatalStageException("bad input");
        });
        h.register(pipeline);
        h.submit("demo", "a");

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.DEAD_LETTERED);

        assertThat(pipeline.calls("a")).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void processBatch_recheckAfterRedeliversSameStageAndUsesAnAttempt() {
        pipeline.on("a", (id, payload, ctx) -> StageResult.recheckAfter(Duration.ofSeconds(30)));
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.REQUEUED);
        assertThat(h.job(job.id()).status()).isEqualTo(JobStatus.QUEUED);
        assertThat(h.runWorker("demo-a")).isEmpty();

        h.clock.advance(Duration.ofSeconds(30));
        h.runWorker("demo-a");
        assertThat(h.job(job.id()).attemptCount()).isEqualTo(2);
    }

    @Test
    void processBatch_pendingAcknowledgesWithoutAdvancing() {
        pipeline.on("a", (id, payload, ctx) -> StageResult.pending());
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");

        assertThat(h.runWorker("demo-a")).extracting(StageOutcome::status).containsExactly(Status.PENDING);
        assertThat(h.job(job.id()).stage()).isEqualTo("a");
        assertThat(h.job(job.id()).lockedBy()).isNull();
        assertThat(h.queue.depth("demo")).isEmpty();
    }

    @Test
    void processBatch_heartbeatRunsWhileHandlerIsBusy() {
        AtomicReference<Instant> seen = new AtomicReference<>();
        Instant later = h.clock.instant().plus(Duration.ofMillis(500));
        pipeline.on("a", (id, payload, ctx) -> {
            h.clock.advance(Duration.ofMillis(500));
            Thread.sleep(1200);
            seen.set(h.store.get(id).orElseThrow().heartbeat());
            return StageResult.pending();
        });
        h.register(pipeline, new QueueSettings(Duration.ofSeconds(1), 10, 5, Duration.ofSeconds(60)));
        h.submit("demo", "a");

        h.runWorker("demo-a");

        assertThat(seen.get()).isEqualTo(later);
    }

    @Test
    void processBatch_payloadThatDoesNotFitTheTypeFailsPermanently() {
        record Typed(String name) {}
        StageHandler<Typed> typed = new StageHandler<>() {
            @Override
            public String stage() {
                return "a";
            }

            @Override
            public Class<Typed> payloadType() {
                return Typed.class;
            }

            @Override
            public StageResult handle(UUID jobId, Typed payload, StageContext ctx) {
                return StageResult.complete();
            }
        };
        PipelineDefinition def = new PipelineDefinition() {
            @Override
            public String name() {
                return "demo";
            }

            @Override
            public List<String> stages() {
                return List.of("a");
            }

            @Override
            public List<StageHandler<?>> handlers() {
                return List.of(typed);
            }
        };
        h.registry.register(def, QueueSettings.DEFAULTS);
        JobRecord job = h.submit("demo", "a");

        List<StageOutcome> outcomes = h.runWorker("demo-a");

        assertThat(outcomes).extracting(StageOutcome::status).containsExactly(Status.DEAD_LETTERED);
        assertThat(h.job(job.id()).error()).contains(PayloadValidationException.class.getName());
    }

    @Test
    void stageContext_outputAndItemsArePersisted() {
        pipeline.on("a", (id, payload, ctx) -> {
            ctx.saveOutput(Map.of("words", 1200));
            ctx.upsertItem("intro", ItemStatus.COMPLETED);
            ctx.advance(payload);
            return StageResult.complete();
        });
        pipeline.on("b", (id, payload, ctx) -> {
            JsonNode previous = ctx.output("a").orElseThrow();
            ctx.completeJob(previous);
            return StageResult.complete();
        });
        h.register(pipeline);
        JobRecord job = h.submit("demo", "a");

        h.runWorker("demo-a");
        h.runWorker("demo-b");

        JobRecord done = h.job(job.id());
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.result()).isEqualTo("{\"words\":1200}");
        assertThat(h.store.items(job.id())).hasSize(1);
    }
}
