package com.libragraph.stageflow.core.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.core.job.JobStore;
import com.libragraph.stageflow.core.job.StoreException;
import com.libragraph.stageflow.core.queue.EnqueueOptions;
import com.libragraph.stageflow.core.queue.MessageQueue;
import com.libragraph.stageflow.core.queue.QueueException;
import com.libragraph.stageflow.core.queue.QueueMessage;
import com.libragraph.stageflow.core.queue.StageMessage;
import com.libragraph.stageflow.core.scale.Sleeper;
import com.libragraph.stageflow.core.stage.StageOutcome.Status;
import com.libragraph.stageflow.core.worker.WorkerIdentity;
import com.libragraph.stageflow.util.Backoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Processes leased messages for one stage: verifies routing, leases the job, runs the
 * handler under a heartbeat, and applies the success, retry and dead-letter policy.
 *
 * <p>Messages of a batch run in parallel and in isolation: no message's failure, including a
 * store or queue failure while recording it, affects its siblings. A message whose outcome
 * could not be recorded is left un-archived and is redelivered after its visibility timeout.
 *
 * <p>A handler failure classified as retryable may be retried in process, up to
 * {@code stageflow.runner.handler-max-tries} tries in total, before the failure counts against
 * the job's attempts. The default of one try disables this.
 */
@ApplicationScoped
public class StageRunner {

    private static final Logger log = Logger.getLogger(StageRunner.class);

    @Inject
    JobStore store;

    @Inject
    MessageQueue queue;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    HeartbeatScheduler heartbeats;

    @Inject
    WorkerIdentity identity;

    @Inject
    @Named("stageExecutor")
    ExecutorService executor;

    @Inject
    Clock clock;

    @ConfigProperty(name = "stageflow.runner.handler-max-tries", defaultValue = "1")
    int handlerMaxTries = 1;

    @ConfigProperty(name = "stageflow.runner.handler-retry-base-ms", defaultValue = "250")
    long handlerRetryBaseMs = 250;

    @ConfigProperty(name = "stageflow.runner.handler-retry-max-ms", defaultValue = "8000")
    long handlerRetryMaxMs = 8000;

    Sleeper sleeper = Sleeper.THREAD;

    public StageRunner() {
    }

    public StageRunner(JobStore store, MessageQueue queue, ObjectMapper objectMapper,
                       HeartbeatScheduler heartbeats, WorkerIdentity identity, ExecutorService executor,
                       Clock clock) {
        this.store = store;
        this.queue = queue;
        this.objectMapper = objectMapper;
        this.heartbeats = heartbeats;
        this.identity = identity;
        this.executor = executor;
        this.clock = clock;
    }

    public List<StageOutcome> processBatch(StageBinding binding, List<QueueMessage> messages) {
        List<CompletableFuture<StageOutcome>> futures = new ArrayList<>(messages.size());
        for (QueueMessage message : messages) {
            futures.add(CompletableFuture.supplyAsync(() -> process(binding, message), executor));
        }
        List<StageOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<StageOutcome> f : futures) {
            outcomes.add(f.join());
        }
        log.debugf("Batch for %s finished: %s", binding.workerName(), outcomes);
        return outcomes;
    }

    /** Processes one message. Never throws. */
    public StageOutcome process(StageBinding binding, QueueMessage message) {
        StageMessage body = message.body();
        try {
            if (body.jobId() == null) {
                queue.archive(binding.queue(), message.msgId());
                log.warnf("Message %d on %s has no job id; archived", message.msgId(), binding.queue());
                return StageOutcome.of(Status.INVALID, message.msgId(), null, body.stage(), "missing_job_id");
            }
            if (!binding.stage().equals(body.stage())) {
                return forward(binding, message);
            }

            Optional<JobRecord> leased = store.startStage(body.jobId(), binding.stage(),
                    identity.id(), binding.settings().visibility());
            if (leased.isEmpty()) {
                return unleasable(binding, message);
            }
            return run(binding, message, leased.get());
        } catch (StoreException | QueueException e) {
            log.errorf(e, "Message %d (job %s, stage %s) abandoned for redelivery",
                    message.msgId(), body.jobId(), body.stage());
            return StageOutcome.of(Status.ABANDONED, message.msgId(), body.jobId(), body.stage(), e.getMessage());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.errorf(e, "Unexpected error processing message %d (job %s)", message.msgId(), body.jobId());
            return StageOutcome.of(Status.ABANDONED, message.msgId(), body.jobId(), body.stage(), e.getMessage());
        }
    }

    private StageOutcome run(StageBinding binding, QueueMessage message, JobRecord job) {
        store.appendEvent(JobEvent.of(job, EventType.PROCESSING,
                "Attempt " + job.attemptCount() + " of " + job.maxAttempts()));

        DefaultStageContext ctx = new DefaultStageContext(job, message, binding, store, queue,
                objectMapper, identity.id());
        long started = System.nanoTime();
        StageResult result;
        try (HeartbeatScheduler.Heartbeat ignored = heartbeats.start(
                "job " + job.id() + " stage " + binding.stage(),
                binding.settings().heartbeatInterval(), ctx::heartbeat)) {
            result = invoke(binding, job.id(), message.body().payload(), ctx);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            return onFailure(binding, message, job, e, elapsedMillis(started));
        }
        return onSuccess(binding, message, job, result, elapsedMillis(started));
    }

    @SuppressWarnings("unchecked")
    private StageResult invoke(StageBinding binding, UUID jobId, JsonNode payload, StageContext ctx)
            throws Exception {
        StageHandler<Object> handler = (StageHandler<Object>) binding.handler();
        Object typed = convert(handler.payloadType(), payload);
        int tries = Math.max(handlerMaxTries, 1);
        for (int attempt = 1; ; attempt++) {
            try {
                StageResult result = handler.handle(jobId, typed, ctx);
                return result != null ? result : StageResult.complete();
            } catch (Exception e) {
                if (attempt >= tries || !StageError.isRetryable(e)) {
                    throw e;
                }
                Duration delay = handlerRetryDelay(attempt);
                log.warnf("Job %s stage %s try %d/%d failed, retrying in %dms: %s", jobId, binding.stage(),
                        attempt, tries, delay.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    /** Exponential from the base delay, capped, with up to 25% jitter either way. */
    Duration handlerRetryDelay(int attempt) {
        Duration base = Duration.ofMillis(Math.max(handlerRetryBaseMs, 0));
        Duration cap = Duration.ofMillis(Math.max(handlerRetryMaxMs, handlerRetryBaseMs));
        long millis = Backoff.exponential(base, cap, attempt).toMillis();
        long jitter = millis / 4;
        if (jitter == 0) {
            return Duration.ofMillis(millis);
        }
        return Duration.ofMillis(millis + ThreadLocalRandom.current().nextLong(-jitter, jitter + 1));
    }

    private Object convert(Class<?> type, JsonNode payload) {
        JsonNode node = payload != null && !payload.isNull() ? payload : objectMapper.createObjectNode();
        if (type.isInstance(node)) {
            return node;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadValidationException(
                    "Payload does not match " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private StageOutcome onSuccess(StageBinding binding, QueueMessage message, JobRecord job,
                                   StageResult result, long durationMs) {
        if (result.recheckAfter() != null) {
            store.recordRetry(job.id(), binding.stage(), null);
            queue.requeue(binding.queue(), message.msgId(), message.body(),
                    EnqueueOptions.priority(message.priority()).withDelay(result.recheckAfter()));
            store.appendEvent(JobEvent.of(job, EventType.PENDING,
                    "Recheck in " + result.recheckAfter().toSeconds() + "s").withDuration(durationMs));
            return StageOutcome.of(Status.REQUEUED, message.msgId(), job.id(), binding.stage(), "recheck");
        }

        EventType type = result.done() ? EventType.STAGE_COMPLETED : EventType.PENDING;
        store.appendEvent(JobEvent.of(job, type, "Stage " + binding.stage() + " "
                + (result.done() ? "completed" : "pending")).withDuration(durationMs));
        store.release(job.id(), identity.id());
        queue.archive(binding.queue(), message.msgId());
        log.debugf("Job %s stage %s %s in %dms", job.id(), binding.stage(), type.label(), durationMs);
        return StageOutcome.of(result.done() ? Status.COMPLETED : Status.PENDING,
                message.msgId(), job.id(), binding.stage(), null);
    }

    private StageOutcome onFailure(StageBinding binding, QueueMessage message, JobRecord job,
                                   Throwable e, long durationMs) {
        StageError error = StageError.from(e);
        ObjectNode metadata = objectMapper.createObjectNode()
                .put("reason", error.reason())
                .put("exception_type", error.exceptionType())
                .put("retryable", error.retryable());
        store.appendEvent(JobEvent.of(job, EventType.ERROR, error.message())
                .withMetadata(metadata.toString())
                .withDuration(durationMs));

        if (!error.retryable()) {
            log.warnf("Job %s stage %s failed permanently: %s", job.id(), binding.stage(), error.message());
            return deadLetter(binding, message, job, error.reason(), error);
        }
        if (job.attemptsExhausted()) {
            log.warnf("Job %s stage %s exhausted %d attempts: %s",
                    job.id(), binding.stage(), job.maxAttempts(), error.message());
            return deadLetter(binding, message, job, "max_attempts_exceeded", error);
        }

        Duration delay = Backoff.ofSeconds(job.retryDelaySeconds()).delayFor(job.attemptCount());
        store.recordRetry(job.id(), binding.stage(), toJson(error));
        try {
            queue.requeue(binding.queue(), message.msgId(), message.body(),
                    EnqueueOptions.priority(message.priority()).withDelay(delay));
        } catch (QueueException qe) {
            log.errorf(qe, "Requeue of job %s stage %s failed", job.id(), binding.stage());
            return deadLetter(binding, message, job, "requeue_failed", error);
        }
        store.appendEvent(JobEvent.of(job, EventType.REQUEUED, "Retry in " + delay.toSeconds() + "s"));
        log.infof("Job %s stage %s attempt %d/%d failed, retry in %ds: %s", job.id(), binding.stage(),
                job.attemptCount(), job.maxAttempts(), delay.toSeconds(), error.message());
        return StageOutcome.of(Status.REQUEUED, message.msgId(), job.id(), binding.stage(), error.reason());
    }

    private StageOutcome unleasable(StageBinding binding, QueueMessage message) {
        UUID jobId = message.body().jobId();
        Optional<JobRecord> current = store.get(jobId);
        if (current.isEmpty()) {
            queue.archive(binding.queue(), message.msgId());
            log.warnf("Message %d references unknown job %s; archived", message.msgId(), jobId);
            return StageOutcome.of(Status.INVALID, message.msgId(), jobId, binding.stage(), "unknown_job");
        }
        JobRecord job = current.get();
        if (job.status().isTerminal() || !job.stage().equals(binding.stage())) {
            queue.archive(binding.queue(), message.msgId());
            log.debugf("Stale message %d for job %s (status=%s, stage=%s); archived",
                    message.msgId(), jobId, job.status().label(), job.stage());
            return StageOutcome.of(Status.STALE, message.msgId(), jobId, binding.stage(), job.status().label());
        }
        if (job.lockedBy() != null && job.leaseExpiresAt() != null
                && job.leaseExpiresAt().isAfter(clock.instant())) {
            log.debugf("Job %s is leased by %s until %s; message %d left for redelivery",
                    jobId, job.lockedBy(), job.leaseExpiresAt(), message.msgId());
            return StageOutcome.of(Status.ABANDONED, message.msgId(), jobId, binding.stage(), "lease_conflict");
        }
        if (job.attemptsExhausted()) {
            StageError error = StageError.of("Stage " + binding.stage() + " used all " + job.maxAttempts()
                    + " attempts", "max_attempts_exceeded", false);
            return deadLetter(binding, message, job, "max_attempts_exceeded", error);
        }
        return StageOutcome.of(Status.ABANDONED, message.msgId(), jobId, binding.stage(), "lease_conflict");
    }

    private StageOutcome forward(StageBinding binding, QueueMessage message) {
        StageMessage body = message.body();
        if (!binding.pipeline().stages().contains(body.stage())) {
            queue.archive(binding.queue(), message.msgId());
            log.warnf("Message %d names unknown stage '%s'; archived", message.msgId(), body.stage());
            return StageOutcome.of(Status.INVALID, message.msgId(), body.jobId(), body.stage(), "unknown_stage");
        }
        // The original is still live, so a plain enqueue would be dropped as a duplicate.
        queue.requeue(binding.queue(), message.msgId(), body, EnqueueOptions.priority(message.priority()));
        store.get(body.jobId()).ifPresent(job -> store.appendEvent(JobEvent.of(job, EventType.FORWARDED,
                "Forwarded from " + binding.stage() + " worker").atStage(body.stage())));
        log.infof("Message %d for job %s forwarded from %s to %s",
                message.msgId(), body.jobId(), binding.stage(), body.stage());
        return StageOutcome.of(Status.FORWARDED, message.msgId(), body.jobId(), body.stage(), null);
    }

    private StageOutcome deadLetter(StageBinding binding, QueueMessage message, JobRecord job,
                                    String reason, StageError error) {
        String errorJson = toJson(error);
        store.fail(job.id(), binding.stage(), errorJson);
        queue.deadLetter(binding.queue(), message, reason, objectMapper.valueToTree(error));
        store.appendEvent(JobEvent.of(job, EventType.DEAD_LETTERED, reason));
        return StageOutcome.of(Status.DEAD_LETTERED, message.msgId(), job.id(), binding.stage(), reason);
    }

    private String toJson(StageError error) {
        try {
            return objectMapper.writeValueAsString(error);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stage error", e);
        }
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
