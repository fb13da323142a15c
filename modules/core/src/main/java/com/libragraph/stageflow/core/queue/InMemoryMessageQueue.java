package com.libragraph.stageflow.core.queue;

import com.fasterxml.jackson.databind.JsonNode;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Heap-backed MessageQueue for development and testing.
 *
 * <p>Same delivery semantics as the PostgreSQL queue: visibility deadlines are checked
 * against the injected {@link Clock}, and all operations are serialized on the instance
 * monitor so concurrent dequeues never hand out the same message.
 * Nothing survives a restart.
 */
@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "memory")
public class InMemoryMessageQueue implements MessageQueue {

    private final Clock clock;
    private final Map<Long, Entry> live = new LinkedHashMap<>();
    private final List<DeadLetter> deadLetters = new ArrayList<>();
    private long nextId = 1;

    @Inject
    public InMemoryMessageQueue(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized OptionalLong enqueue(String queue, StageMessage message, EnqueueOptions options) {
        return insert(queue, message, options);
    }

    @Override
    public synchronized List<QueueMessage> dequeueBatch(String queue, Duration visibility, int batchSize) {
        requirePositive(batchSize);
        Instant now = clock.instant();
        List<Entry> ready = live.values().stream()
                .filter(e -> e.queue.equals(queue) && !e.visibleAt.isAfter(now))
                .sorted(Comparator.comparingInt((Entry e) -> e.priority).reversed()
                        .thenComparingLong(e -> e.msgId))
                .limit(batchSize)
                .toList();

        List<QueueMessage> leased = new ArrayList<>(ready.size());
        for (Entry e : ready) {
            e.visibleAt = now.plus(visibility);
            e.readCount++;
            leased.add(e.toMessage());
        }
        return leased;
    }

    @Override
    public synchronized boolean archive(String queue, long msgId) {
        Entry e = live.get(msgId);
        if (e == null || !e.queue.equals(queue)) {
            return false;
        }
        live.remove(msgId);
        return true;
    }

    @Override
    public synchronized boolean extendVisibility(String queue, long msgId, Duration visibility) {
        Entry e = live.get(msgId);
        if (e == null || !e.queue.equals(queue)) {
            return false;
        }
        e.visibleAt = clock.instant().plus(visibility);
        return true;
    }

    @Override
    public synchronized OptionalLong requeue(String queue, long msgId, StageMessage message,
                                             EnqueueOptions options) {
        archive(queue, msgId);
        return insert(queue, message, options);
    }

    @Override
    public synchronized void deadLetter(String queue, QueueMessage message, String reason, JsonNode error) {
        archive(queue, message.msgId());
        StageMessage body = message.body();
        deadLetters.add(new DeadLetter(message.msgId(), queue, body.jobId(), body.stage(),
                body.payload(), reason, error, message.readCount(), clock.instant()));
    }

    @Override
    public synchronized List<StageDepth> depth(String queue) {
        Instant now = clock.instant();
        Map<String, long[]> counts = new TreeMap<>();
        for (Entry e : live.values()) {
            if (!e.queue.equals(queue)) continue;
            long[] c = counts.computeIfAbsent(e.stage, k -> new long[2]);
            c[e.visibleAt.isAfter(now) ? 1 : 0]++;
        }
        List<StageDepth> result = new ArrayList<>(counts.size());
        counts.forEach((stage, c) -> result.add(new StageDepth(stage, c[0], c[1])));
        return result;
    }

    @Override
    public synchronized List<DeadLetter> deadLetters(String queue, int limit) {
        return deadLetters.stream()
                .filter(d -> d.queue().equals(queue))
                .sorted(Comparator.comparing(DeadLetter::failedAt).reversed())
                .limit(limit)
                .toList();
    }

    private OptionalLong insert(String queue, StageMessage message, EnqueueOptions options) {
        Objects.requireNonNull(message, "message cannot be null");
        if (message.jobId() != null && hasLive(queue, message)) {
            return OptionalLong.empty();
        }
        Instant now = clock.instant();
        long id = nextId++;
        JsonNode payload = message.payload() == null ? null : message.payload().deepCopy();
        live.put(id, new Entry(id, queue, new StageMessage(message.jobId(), message.stage(), payload),
                options.priority(), now, now.plus(options.delay())));
        return OptionalLong.of(id);
    }

    private boolean hasLive(String queue, StageMessage message) {
        for (Entry e : live.values()) {
            if (e.queue.equals(queue) && message.jobId().equals(e.body.jobId())
                    && e.stage.equals(message.stage())) {
                return true;
            }
        }
        return false;
    }

    private static void requirePositive(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
    }

    private static final class Entry {
        final long msgId;
        final String queue;
        final String stage;
        final StageMessage body;
        final int priority;
        final Instant enqueuedAt;
        Instant visibleAt;
        int readCount;

        Entry(long msgId, String queue, StageMessage body, int priority, Instant enqueuedAt, Instant visibleAt) {
            this.msgId = msgId;
            this.queue = queue;
            this.stage = body.stage();
            this.body = body;
            this.priority = priority;
            this.enqueuedAt = enqueuedAt;
            this.visibleAt = visibleAt;
        }

        QueueMessage toMessage() {
            return new QueueMessage(msgId, queue, body, priority, readCount, enqueuedAt, visibleAt);
        }
    }
}
