package com.libragraph.stageflow.core.dao;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.mapper.reflect.ConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(QueueRow.class)
@RegisterConstructorMapper(StageDepthRow.class)
@RegisterConstructorMapper(DeadLetterRow.class)
public interface QueueDao {

    /** Returns empty when a live message for the same job and stage already exists. */
    @SqlQuery("INSERT INTO queue_message (queue, job_id, stage, payload, priority, visible_at) " +
            "VALUES (:queue, :jobId, :stage, CAST(:payload AS jsonb), :priority, " +
            "now() + make_interval(secs => :delaySeconds)) " +
            "ON CONFLICT DO NOTHING RETURNING msg_id")
    Optional<Long> insert(@Bind("queue") String queue,
                          @Bind("jobId") UUID jobId,
                          @Bind("stage") String stage,
                          @Bind("payload") String payload,
                          @Bind("priority") int priority,
                          @Bind("delaySeconds") double delaySeconds);

    @SqlUpdate("UPDATE queue_message SET archived_at = now() " +
            "WHERE queue = :queue AND msg_id = :msgId AND archived_at IS NULL")
    int archive(@Bind("queue") String queue, @Bind("msgId") long msgId);

    @SqlUpdate("UPDATE queue_message SET visible_at = now() + make_interval(secs => :visibilitySeconds) " +
            "WHERE queue = :queue AND msg_id = :msgId AND archived_at IS NULL")
    int extendVisibility(@Bind("queue") String queue,
                         @Bind("msgId") long msgId,
                         @Bind("visibilitySeconds") double visibilitySeconds);

    @SqlUpdate("INSERT INTO dead_letter (queue, msg_id, job_id, stage, payload, reason, error, read_count) " +
            "VALUES (:queue, :msgId, :jobId, :stage, CAST(:payload AS jsonb), :reason, " +
            "CAST(:error AS jsonb), :readCount)")
    void insertDeadLetter(@Bind("queue") String queue,
                          @Bind("msgId") long msgId,
                          @Bind("jobId") UUID jobId,
                          @Bind("stage") String stage,
                          @Bind("payload") String payload,
                          @Bind("reason") String reason,
                          @Bind("error") String error,
                          @Bind("readCount") int readCount);

    @SqlQuery("SELECT stage, " +
            "COUNT(*) FILTER (WHERE visible_at <= now()) AS ready, " +
            "COUNT(*) FILTER (WHERE visible_at > now()) AS in_flight " +
            "FROM queue_message WHERE queue = :queue AND archived_at IS NULL " +
            "GROUP BY stage ORDER BY stage")
    List<StageDepthRow> depth(@Bind("queue") String queue);

    @SqlQuery("SELECT msg_id, queue, job_id, stage, payload::text AS payload, reason, " +
            "error::text AS error, read_count, failed_at " +
            "FROM dead_letter WHERE queue = :queue ORDER BY failed_at DESC, id DESC LIMIT :limit")
    List<DeadLetterRow> deadLetters(@Bind("queue") String queue, @Bind("limit") int limit);

    /**
     * Leases up to {@code batchSize} visible messages.
     * Uses a CTE with FOR UPDATE SKIP LOCKED so concurrent consumers never share a message.
     */
    default List<QueueRow> dequeue(Handle handle, String queue, double visibilitySeconds, int batchSize) {
        String sql = """
                WITH ready AS (
                    SELECT m.msg_id
                    FROM queue_message m
                    WHERE m.queue = :queue
                      AND m.archived_at IS NULL
                      AND m.visible_at <= now()
                    ORDER BY m.priority DESC, m.msg_id
                    LIMIT :batchSize
                    FOR UPDATE OF m SKIP LOCKED
                )
                UPDATE queue_message
                SET visible_at = now() + make_interval(secs => :visibilitySeconds),
                    read_count = queue_message.read_count + 1
                FROM ready
                WHERE queue_message.msg_id = ready.msg_id
                RETURNING queue_message.msg_id, queue_message.queue, queue_message.job_id,
                          queue_message.stage, queue_message.payload::text AS payload,
                          queue_message.priority, queue_message.read_count,
                          queue_message.enqueued_at, queue_message.visible_at
                """;

        return handle.createQuery(sql)
                .bind("queue", queue)
                .bind("batchSize", batchSize)
                .bind("visibilitySeconds", visibilitySeconds)
                .map(ConstructorMapper.of(QueueRow.class))
                .list();
    }
}
