package com.libragraph.stageflow.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record StageDepthRow(
        @ColumnName("stage") String stage,
        @ColumnName("ready") long ready,
        @ColumnName("in_flight") long inFlight
) {}
