package com.libragraph.stageflow.core.intake;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.util.UUID;

public record Page(
        @ColumnName("id") UUID id,
        @ColumnName("url") String url,
        @ColumnName("created_at") Instant createdAt
) {}
