package com.libragraph.stageflow.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record StageLeaseRow(
        @ColumnName("stage") String stage,
        @ColumnName("leases") long leases
) {}
