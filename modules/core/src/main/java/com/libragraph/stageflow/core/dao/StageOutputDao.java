package com.libragraph.stageflow.core.dao;

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;
import java.util.UUID;

public interface StageOutputDao {

    @SqlUpdate("INSERT INTO stage_output (job_id, stage, output) VALUES (:jobId, :stage, CAST(:output AS jsonb)) " +
            "ON CONFLICT (job_id, stage) DO UPDATE SET output = EXCLUDED.output, updated_at = now()")
    void upsert(@Bind("jobId") UUID jobId, @Bind("stage") String stage, @Bind("output") String output);

    @SqlQuery("SELECT output::text FROM stage_output WHERE job_id = :jobId AND stage = :stage")
    Optional<String> find(@Bind("jobId") UUID jobId, @Bind("stage") String stage);
}
