package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.core.job.JobRecord;
import com.libragraph.stageflow.types.JobStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * SQL for {@code pipeline_job}. Predicates on {@code status IN (0, 1)} select active
 * (queued or processing) jobs; see {@link JobStatus} for the ids.
 */
@RegisterColumnMapper(JobStatusColumnMapper.class)
@RegisterArgumentFactory(JobStatusArgumentFactory.class)
@RegisterConstructorMapper(JobRecord.class)
@RegisterConstructorMapper(StageLeaseRow.class)
public interface JobDao {

    /** Empty when a dedup or idempotency key collides with an existing job. */
    @SqlQuery("INSERT INTO pipeline_job (id, queue, stage, status, payload, priority, max_attempts, " +
            "retry_delay_seconds, dedup_key, idempotency_key) " +
            "VALUES (:id, :queue, :stage, :status, CAST(:payload AS jsonb), :priority, :maxAttempts, " +
            ":retryDelaySeconds, :dedupKey, :idempotencyKey) " +
            "ON CONFLICT DO NOTHING RETURNING *")
    Optional<JobRecord> insert(@Bind("id") UUID id,
                               @Bind("queue") String queue,
                               @Bind("stage") String stage,
                               @Bind("status") JobStatus status,
                               @Bind("payload") String payload,
                               @Bind("priority") int priority,
                               @Bind("maxAttempts") int maxAttempts,
                               @Bind("retryDelaySeconds") int retryDelaySeconds,
                               @Bind("dedupKey") String dedupKey,
                               @Bind("idempotencyKey") String idempotencyKey);

    @SqlQuery("SELECT * FROM pipeline_job WHERE id = :id")
    Optional<JobRecord> findById(@Bind("id") UUID id);

    @SqlQuery("SELECT * FROM pipeline_job WHERE queue = :queue AND dedup_key = :dedupKey " +
            "AND status IN (0, 1)")
    Optional<JobRecord> findActiveByDedupKey(@Bind("queue") String queue, @Bind("dedupKey") String dedupKey);

    @SqlQuery("SELECT * FROM pipeline_job WHERE queue = :queue AND idempotency_key = :key")
    Optional<JobRecord> findByIdempotencyKey(@Bind("queue") String queue, @Bind("key") String key);

    @SqlQuery("UPDATE pipeline_job SET status = :status, attempt_count = attempt_count + 1, " +
            "heartbeat = now(), locked_by = :workerId, " +
            "lease_expires_at = now() + make_interval(secs => :leaseSeconds), updated_at = now() " +
            "WHERE id = :id AND stage = :stage AND status IN (0, 1) AND attempt_count < max_attempts " +
            "AND (locked_by IS NULL OR lease_expires_at IS NULL OR lease_expires_at <= now()) " +
            "RETURNING *")
    Optional<JobRecord> startStage(@Bind("id") UUID id,
                                   @Bind("stage") String stage,
                                   @Bind("status") JobStatus status,
                                   @Bind("workerId") String workerId,
                                   @Bind("leaseSeconds") double leaseSeconds);

    @SqlUpdate("UPDATE pipeline_job SET heartbeat = now(), " +
            "lease_expires_at = now() + make_interval(secs => :leaseSeconds), updated_at = now() " +
            "WHERE id = :id AND locked_by = :workerId AND status = 1")
    int heartbeat(@Bind("id") UUID id, @Bind("workerId") String workerId,
                  @Bind("leaseSeconds") double leaseSeconds);

    @SqlUpdate("UPDATE pipeline_job SET locked_by = NULL, lease_expires_at = NULL, updated_at = now() " +
            "WHERE id = :id AND locked_by = :workerId")
    int release(@Bind("id") UUID id, @Bind("workerId") String workerId);

    @SqlUpdate("UPDATE pipeline_job SET stage = :toStage, status = :status, attempt_count = 0, " +
            "payload = COALESCE(CAST(:payload AS jsonb), payload), heartbeat = now(), " +
            "locked_by = NULL, lease_expires_at = NULL, updated_at = now() " +
            "WHERE id = :id AND stage = :fromStage AND status IN (0, 1)")
    int advance(@Bind("id") UUID id,
                @Bind("fromStage") String fromStage,
                @Bind("toStage") String toStage,
                @Bind("status") JobStatus status,
                @Bind("payload") String payload);

    @SqlUpdate("UPDATE pipeline_job SET status = :status, " +
            "result = COALESCE(CAST(:result AS jsonb), result), " +
            "error = COALESCE(CAST(:error AS jsonb), error), " +
            "locked_by = NULL, lease_expires_at = NULL, updated_at = now() " +
            "WHERE id = :id AND stage = :stage AND status IN (0, 1)")
    int finish(@Bind("id") UUID id,
               @Bind("stage") String stage,
               @Bind("status") JobStatus status,
               @Bind("result") String result,
               @Bind("error") String error);

    @SqlUpdate("UPDATE pipeline_job SET status = :status, error = CAST(:error AS jsonb), " +
            "locked_by = NULL, lease_expires_at = NULL, updated_at = now() " +
            "WHERE id = :id AND stage = :stage AND status IN (0, 1)")
    int recordRetry(@Bind("id") UUID id,
                    @Bind("stage") String stage,
                    @Bind("status") JobStatus status,
                    @Bind("error") String error);

    @SqlQuery("SELECT * FROM pipeline_job WHERE queue = :queue AND status IN (0, 1) " +
            "AND heartbeat < :staleBefore ORDER BY heartbeat, created_at LIMIT :limit " +
            "FOR UPDATE SKIP LOCKED")
    List<JobRecord> findStale(@Bind("queue") String queue,
                              @Bind("staleBefore") Instant staleBefore,
                              @Bind("limit") int limit);

    @SqlQuery("UPDATE pipeline_job SET stage = :stage, status = :status, " +
            "attempt_count = CASE WHEN stage = :stage THEN attempt_count ELSE 0 END, " +
            "error = NULL, heartbeat = now(), locked_by = NULL, lease_expires_at = NULL, " +
            "updated_at = now() WHERE id = :id RETURNING *")
    JobRecord resume(@Bind("id") UUID id, @Bind("stage") String stage, @Bind("status") JobStatus status);

    @SqlUpdate("UPDATE pipeline_job SET locked_by = NULL, lease_expires_at = NULL, updated_at = now() " +
            "WHERE locked_by IS NOT NULL AND lease_expires_at < :now")
    int clearExpiredLeases(@Bind("now") Instant now);

    @SqlQuery("SELECT stage, COUNT(*) AS leases FROM pipeline_job " +
            "WHERE queue = :queue AND locked_by IS NOT NULL GROUP BY stage ORDER BY stage")
    List<StageLeaseRow> activeLeases(@Bind("queue") String queue);
}
