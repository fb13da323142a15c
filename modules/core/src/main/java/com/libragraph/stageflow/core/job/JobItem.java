package com.libragraph.stageflow.core.job;

import com.libragraph.stageflow.types.ItemStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record JobItem(
        @ColumnName("job_id") UUID jobId,
        @ColumnName("item_key") String itemKey,
        @ColumnName("stage") String stage,
        @ColumnName("status") ItemStatus status,
        @ColumnName("updated_at") Instant updatedAt
) {}
