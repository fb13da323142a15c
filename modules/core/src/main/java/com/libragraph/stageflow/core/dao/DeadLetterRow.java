package com.libragraph.stageflow.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record DeadLetterRow(
        @ColumnName("msg_id") long msgId,
        @ColumnName("queue") String queue,
        @ColumnName("job_id") UUID jobId,
        @ColumnName("stage") String stage,
        @ColumnName("payload") String payload,
        @ColumnName("reason") String reason,
        @ColumnName("error") String error,
        @ColumnName("read_count") int readCount,
        @ColumnName("failed_at") Instant failedAt
) {}
