package com.libragraph.stageflow.core.job;

import com.libragraph.stageflow.types.ItemStatus;
import com.libragraph.stageflow.types.JobStatus;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Heap-backed JobStore for development and testing. All operations are serialized on the
 * instance monitor, which gives the same conditional-update semantics as the SQL store.
 */
@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Clock clock;
    private final Map<UUID, JobRecord> jobs = new LinkedHashMap<>();
    private final List<JobEvent> events = new ArrayList<>();
    private final Map<UUID, Map<String, JobItem>> items = new HashMap<>();
    private final Map<UUID, Map<String, String>> outputs = new HashMap<>();

    @Inject
    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized CreateResult createIfAbsent(NewJob job) {
        Optional<JobRecord> existing = jobs.values().stream()
                .filter(j -> j.queue().equals(job.queue()))
                .filter(j -> (job.idempotencyKey() != null && job.idempotencyKey().equals(j.idempotencyKey()))
                        || (job.dedupKey() != null && job.dedupKey().equals(j.dedupKey())
                        && !j.status().isTerminal()))
                .findFirst();
        if (existing.isPresent()) {
            return new CreateResult(existing.get(), false);
        }
        Instant now = clock.instant();
        JobRecord record = new JobRecord(job.id(), job.queue(), job.stage(), JobStatus.QUEUED, job.payload(),
                0, job.maxAttempts(), job.retryDelaySeconds(), job.priority(), job.dedupKey(),
                job.idempotencyKey(), now, null, null, null, null, now, now);
        jobs.put(job.id(), record);
        return new CreateResult(record, true);
    }

    @Override
    public synchronized Optional<JobRecord> get(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized Optional<JobRecord> startStage(UUID id, String stage, String workerId, Duration lease) {
        JobRecord j = jobs.get(id);
        Instant now = clock.instant();
        if (j == null || j.status().isTerminal() || !j.stage().equals(stage) || j.attemptsExhausted()
                || leaseLive(j, now)) {
            return Optional.empty();
        }
        return Optional.of(put(new Builder(j)
                .status(JobStatus.PROCESSING)
                .attemptCount(j.attemptCount() + 1)
                .heartbeat(now)
                .lock(workerId, now.plus(lease))
                .build(now)));
    }

    private static boolean leaseLive(JobRecord j, Instant now) {
        return j.lockedBy() != null && j.leaseExpiresAt() != null && j.leaseExpiresAt().isAfter(now);
    }

    @Override
    public synchronized boolean heartbeat(UUID id, String workerId, Duration lease) {
        JobRecord j = jobs.get(id);
        if (j == null || j.status() != JobStatus.PROCESSING || !Objects.equals(j.lockedBy(), workerId)) {
            return false;
        }
        Instant now = clock.instant();
        put(new Builder(j).heartbeat(now).lock(workerId, now.plus(lease)).build(now));
        return true;
    }

    @Override
    public synchronized boolean release(UUID id, String workerId) {
        JobRecord j = jobs.get(id);
        if (j == null || !Objects.equals(j.lockedBy(), workerId)) {
            return false;
        }
        put(new Builder(j).lock(null, null).build(clock.instant()));
        return true;
    }

    @Override
    public synchronized boolean advance(UUID id, String fromStage, String toStage, String payload) {
        JobRecord j = jobs.get(id);
        if (j == null || j.status().isTerminal() || !j.stage().equals(fromStage)) {
            return false;
        }
        Instant now = clock.instant();
        put(new Builder(j)
                .stage(toStage)
                .status(JobStatus.QUEUED)
                .attemptCount(0)
                .payload(payload != null ? payload : j.payload())
                .heartbeat(now)
                .lock(null, null)
                .build(now));
        return true;
    }

    @Override
    public synchronized boolean complete(UUID id, String stage, String result) {
        return finish(id, stage, JobStatus.COMPLETED, result, null);
    }

    @Override
    public synchronized boolean fail(UUID id, String stage, String error) {
        return finish(id, stage, JobStatus.FAILED, null, error);
    }

    @Override
    public synchronized boolean recordRetry(UUID id, String stage, String error) {
        JobRecord j = jobs.get(id);
        if (j == null || j.status().isTerminal() || !j.stage().equals(stage)) {
            return false;
        }
        put(new Builder(j).status(JobStatus.QUEUED).error(error).lock(null, null).build(clock.instant()));
        return true;
    }

    @Override
    public synchronized List<JobRecord> rescueStale(String queue, Instant staleBefore, int limit,
                                                    UnaryOperator<String> resumeStage) {
        List<JobRecord> stale = jobs.values().stream()
                .filter(j -> j.queue().equals(queue))
                .filter(j -> !j.status().isTerminal() && j.heartbeat().isBefore(staleBefore))
                .sorted(Comparator.comparing(JobRecord::heartbeat).thenComparing(JobRecord::createdAt))
                .limit(limit)
                .toList();

        Instant now = clock.instant();
        List<JobRecord> rescued = new ArrayList<>(stale.size());
        for (JobRecord j : stale) {
            String stage = resumeStage.apply(j.stage());
            Builder b = new Builder(j)
                    .status(JobStatus.QUEUED)
                    .error(null)
                    .heartbeat(now)
                    .lock(null, null);
            if (!stage.equals(j.stage())) {
                b.stage(stage).attemptCount(0);
            }
            JobRecord resumed = put(b.build(now));
            Map<String, JobItem> owned = items.get(j.id());
            if (owned != null) owned.replaceAll((key, item) -> item.status() == ItemStatus.PROCESSING
                    ? new JobItem(item.jobId(), key, item.stage(), ItemStatus.PENDING, now)
                    : item);
            events.add(new JobEvent(j.id(), queue, stage, EventType.RESCUED,
                    "Resumed from stage " + j.stage() + " (status " + j.status().label() + ")",
                    null, null, j.attemptCount(), now));
            rescued.add(resumed);
        }
        return rescued;
    }

    @Override
    public synchronized int clearExpiredLeases(Instant now) {
        int released = 0;
        for (JobRecord j : List.copyOf(jobs.values())) {
            if (j.lockedBy() != null && j.leaseExpiresAt() != null && j.leaseExpiresAt().isBefore(now)) {
                put(new Builder(j).lock(null, null).build(clock.instant()));
                released++;
            }
        }
        return released;
    }

    @Override
    public synchronized Map<String, Long> activeLeases(String queue) {
        Map<String, Long> result = new TreeMap<>();
        for (JobRecord j : jobs.values()) {
            if (j.queue().equals(queue) && j.lockedBy() != null) {
                result.merge(j.stage(), 1L, Long::sum);
            }
        }
        return result;
    }

    @Override
    public synchronized void appendEvent(JobEvent event) {
        Instant at = event.createdAt() != null ? event.createdAt() : clock.instant();
        events.add(new JobEvent(event.jobId(), event.queue(), event.stage(), event.type(), event.message(),
                event.metadata(), event.durationMs(), event.attempt(), at));
    }

    @Override
    public synchronized List<JobEvent> events(UUID jobId) {
        return events.stream().filter(e -> e.jobId().equals(jobId)).toList();
    }

    @Override
    public synchronized List<StageStats> stageStats(String queue, Instant since) {
        Map<String, List<JobEvent>> byStage = new TreeMap<>();
        for (JobEvent e : events) {
            if (queue.equals(e.queue()) && e.stage() != null && !e.createdAt().isBefore(since)
                    && (e.type() == EventType.STAGE_COMPLETED || e.type() == EventType.ERROR)) {
                byStage.computeIfAbsent(e.stage(), k -> new ArrayList<>()).add(e);
            }
        }
        List<StageStats> result = new ArrayList<>();
        byStage.forEach((stage, list) -> {
            long completions = list.stream().filter(e -> e.type() == EventType.STAGE_COMPLETED).count();
            long failures = list.size() - completions;
            double[] durations = list.stream()
                    .filter(e -> e.durationMs() != null)
                    .mapToDouble(JobEvent::durationMs)
                    .sorted()
                    .toArray();
            double avg = durations.length == 0 ? 0.0 : Arrays.stream(durations).average().orElse(0.0);
            result.add(new StageStats(queue, stage, completions, failures, avg, percentile(durations, 0.95)));
        });
        return result;
    }

    @Override
    public synchronized void saveOutput(UUID jobId, String stage, String output) {
        outputs.computeIfAbsent(jobId, k -> new HashMap<>()).put(stage, output);
    }

    @Override
    public synchronized Optional<String> output(UUID jobId, String stage) {
        return Optional.ofNullable(outputs.getOrDefault(jobId, Map.of()).get(stage));
    }

    @Override
    public synchronized void upsertItem(UUID jobId, String itemKey, String stage, ItemStatus status) {
        items.computeIfAbsent(jobId, k -> new LinkedHashMap<>())
                .put(itemKey, new JobItem(jobId, itemKey, stage, status, clock.instant()));
    }

    @Override
    public synchronized List<JobItem> items(UUID jobId) {
        return List.copyOf(items.getOrDefault(jobId, Map.of()).values());
    }

    /** Linear interpolation between closest ranks, matching {@code percentile_cont}. */
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) return 0.0;
        double pos = p * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    private boolean finish(UUID id, String stage, JobStatus status, String result, String error) {
        JobRecord j = jobs.get(id);
        if (j == null || j.status().isTerminal() || !j.stage().equals(stage)) {
            return false;
        }
        Builder b = new Builder(j).status(status).lock(null, null);
        if (result != null) b.result(result);
        if (error != null) b.error(error);
        put(b.build(clock.instant()));
        return true;
    }

    private JobRecord put(JobRecord record) {
        jobs.put(record.id(), record);
        return record;
    }

    private static final class Builder {
        private final JobRecord base;
        private String stage;
        private JobStatus status;
        private String payload;
        private int attemptCount;
        private Instant heartbeat;
        private String lockedBy;
        private Instant leaseExpiresAt;
        private String result;
        private String error;

        Builder(JobRecord base) {
            this.base = base;
            this.stage = base.stage();
            this.status = base.status();
            this.payload = base.payload();
            this.attemptCount = base.attemptCount();
            this.heartbeat = base.heartbeat();
            this.lockedBy = base.lockedBy();
            this.leaseExpiresAt = base.leaseExpiresAt();
            this.result = base.result();
            this.error = base.error();
        }

        Builder stage(String stage) { this.stage = stage; return this; }
        Builder status(JobStatus status) { this.status = status; return this; }
        Builder payload(String payload) { this.payload = payload; return this; }
        Builder attemptCount(int attemptCount) { this.attemptCount = attemptCount; return this; }
        Builder heartbeat(Instant heartbeat) { this.heartbeat = heartbeat; return this; }
        Builder result(String result) { this.result = result; return this; }
        Builder error(String error) { this.error = error; return this; }

        Builder lock(String owner, Instant expiresAt) {
            this.lockedBy = owner;
            this.leaseExpiresAt = expiresAt;
            return this;
        }

        JobRecord build(Instant now) {
            return new JobRecord(base.id(), base.queue(), stage, status, payload, attemptCount,
                    base.maxAttempts(), base.retryDelaySeconds(), base.priority(), base.dedupKey(),
                    base.idempotencyKey(), heartbeat, lockedBy, leaseExpiresAt, result, error,
                    base.createdAt(), now);
        }
    }
}
