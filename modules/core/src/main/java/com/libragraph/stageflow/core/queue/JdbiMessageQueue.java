package com.libragraph.stageflow.core.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.dao.DeadLetterRow;
import com.libragraph.stageflow.core.dao.QueueDao;
import com.libragraph.stageflow.core.dao.QueueRow;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed MessageQueue over the {@code queue_message} table.
 */
@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "postgres", enableIfMissing = true)
public class JdbiMessageQueue implements MessageQueue {

    private static final Logger log = Logger.getLogger(JdbiMessageQueue.class);

    @Inject
    Jdbi jdbi;

    @Inject
    ObjectMapper objectMapper;

    public JdbiMessageQueue() {
    }

    public JdbiMessageQueue(Jdbi jdbi, ObjectMapper objectMapper) {
        this.jdbi = jdbi;
        this.objectMapper = objectMapper;
    }

    @Override
    public OptionalLong enqueue(String queue, StageMessage message, EnqueueOptions options) {
        String payload = serialize(message.payload());
        return call("enqueue", () -> jdbi.withExtension(QueueDao.class, dao ->
                toOptional(dao.insert(queue, message.jobId(), message.stage(), payload,
                        options.priority(), seconds(options.delay())).orElse(null))));
    }

    @Override
    public List<QueueMessage> dequeueBatch(String queue, Duration visibility, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, got: " + batchSize);
        }
        List<QueueRow> rows = call("dequeue", () -> jdbi.inTransaction(handle ->
                handle.attach(QueueDao.class).dequeue(handle, queue, seconds(visibility), batchSize)));
        return rows.stream().map(this::toMessage).toList();
    }

    @Override
    public boolean archive(String queue, long msgId) {
        return call("archive", () -> jdbi.withExtension(QueueDao.class, dao ->
                dao.archive(queue, msgId) > 0));
    }

    @Override
    public boolean extendVisibility(String queue, long msgId, Duration visibility) {
        return call("extend visibility", () -> jdbi.withExtension(QueueDao.class, dao ->
                dao.extendVisibility(queue, msgId, seconds(visibility)) > 0));
    }

    @Override
    public OptionalLong requeue(String queue, long msgId, StageMessage message, EnqueueOptions options) {
        String payload = serialize(message.payload());
        return call("requeue", () -> jdbi.inTransaction(handle -> {
            QueueDao dao = handle.attach(QueueDao.class);
            dao.archive(queue, msgId);
            return toOptional(dao.insert(queue, message.jobId(), message.stage(), payload,
                    options.priority(), seconds(options.delay())).orElse(null));
        }));
    }

    @Override
    public void deadLetter(String queue, QueueMessage message, String reason, JsonNode error) {
        StageMessage body = message.body();
        String payload = serialize(body.payload());
        String errorJson = serialize(error);
        call("dead-letter", () -> jdbi.inTransaction(handle -> {
            QueueDao dao = handle.attach(QueueDao.class);
            dao.insertDeadLetter(queue, message.msgId(), body.jobId(), body.stage(),
                    payload, reason, errorJson, message.readCount());
            return dao.archive(queue, message.msgId());
        }));
        log.warnf("Message %d (queue=%s, stage=%s) dead-lettered: %s",
                message.msgId(), queue, body.stage(), reason);
    }

    @Override
    public List<StageDepth> depth(String queue) {
        return call("depth", () -> jdbi.withExtension(QueueDao.class, dao -> dao.depth(queue))).stream()
                .map(r -> new StageDepth(r.stage(), r.ready(), r.inFlight()))
                .toList();
    }

    @Override
    public List<DeadLetter> deadLetters(String queue, int limit) {
        List<DeadLetterRow> rows = call("read dead letters", () ->
                jdbi.withExtension(QueueDao.class, dao -> dao.deadLetters(queue, limit)));
        return rows.stream()
                .map(r -> new DeadLetter(r.msgId(), r.queue(), r.jobId(), r.stage(), parse(r.payload()),
                        r.reason(), parse(r.error()), r.readCount(), r.failedAt()))
                .toList();
    }

    private QueueMessage toMessage(QueueRow row) {
        return new QueueMessage(row.msgId(), row.queue(),
                new StageMessage(row.jobId(), row.stage(), parse(row.payload())),
                row.priority(), row.readCount(), row.enqueuedAt(), row.visibleAt());
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (JdbiException e) {
            throw new QueueException("Queue " + operation + " failed", e);
        }
    }

    private String serialize(JsonNode value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new QueueException("Failed to serialize message payload", e);
        }
    }

    private JsonNode parse(String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QueueException("Corrupt JSON in queue row", e);
        }
    }

    private static OptionalLong toOptional(Long id) {
        return id == null ? OptionalLong.empty() : OptionalLong.of(id);
    }

    private static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }
}
