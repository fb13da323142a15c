package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.core.job.EventType;
import com.libragraph.stageflow.core.job.JobEvent;
import com.libragraph.stageflow.core.job.StageStats;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RegisterConstructorMapper(JobEvent.class)
@RegisterConstructorMapper(StageStats.class)
public interface JobEventDao {

    @SqlUpdate("INSERT INTO job_event (job_id, queue, stage, type, message, metadata, duration_ms, attempt) " +
            "VALUES (:jobId, :queue, :stage, :type, :message, CAST(:metadata AS jsonb), :durationMs, :attempt)")
    void insert(@Bind("jobId") UUID jobId,
                @Bind("queue") String queue,
                @Bind("stage") String stage,
                @Bind("type") EventType type,
                @Bind("message") String message,
                @Bind("metadata") String metadata,
                @Bind("durationMs") Long durationMs,
                @Bind("attempt") Integer attempt);

    @SqlQuery("SELECT job_id, queue, stage, type, message, metadata, duration_ms, attempt, created_at " +
            "FROM job_event WHERE job_id = :jobId ORDER BY created_at, id")
    List<JobEvent> findByJob(@Bind("jobId") UUID jobId);

    @SqlQuery("SELECT queue, stage, " +
            "COUNT(*) FILTER (WHERE type = 'STAGE_COMPLETED') AS completions, " +
            "COUNT(*) FILTER (WHERE type = 'ERROR') AS failures, " +
            "COALESCE(AVG(duration_ms), 0) AS avg_duration_ms, " +
            "COALESCE(percentile_cont(0.95) WITHIN GROUP (ORDER BY duration_ms), 0) AS p95_duration_ms " +
            "FROM job_event " +
            "WHERE queue = :queue AND stage IS NOT NULL AND created_at >= :since " +
            "AND type IN ('STAGE_COMPLETED', 'ERROR') " +
            "GROUP BY queue, stage ORDER BY stage")
    List<StageStats> stageStats(@Bind("queue") String queue, @Bind("since") Instant since);
}
