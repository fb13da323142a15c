package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.core.job.JobItem;
import com.libragraph.stageflow.types.ItemStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.UUID;

@RegisterColumnMapper(ItemStatusColumnMapper.class)
@RegisterArgumentFactory(ItemStatusArgumentFactory.class)
@RegisterConstructorMapper(JobItem.class)
public interface JobItemDao {

    @SqlUpdate("INSERT INTO job_item (job_id, item_key, stage, status) " +
            "VALUES (:jobId, :itemKey, :stage, :status) " +
            "ON CONFLICT (job_id, item_key) DO UPDATE " +
            "SET stage = EXCLUDED.stage, status = EXCLUDED.status, updated_at = now()")
    void upsert(@Bind("jobId") UUID jobId,
                @Bind("itemKey") String itemKey,
                @Bind("stage") String stage,
                @Bind("status") ItemStatus status);

    @SqlQuery("SELECT * FROM job_item WHERE job_id = :jobId ORDER BY item_key")
    List<JobItem> findByJob(@Bind("jobId") UUID jobId);

    @SqlUpdate("UPDATE job_item SET status = :to, updated_at = now() " +
            "WHERE job_id = :jobId AND status = :from")
    int resetStatus(@Bind("jobId") UUID jobId, @Bind("from") ItemStatus from, @Bind("to") ItemStatus to);
}
