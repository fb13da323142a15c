package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.types.JobStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class JobStatusColumnMapper implements ColumnMapper<JobStatus> {

    @Override
    public JobStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return JobStatus.fromId(r.getShort(columnNumber));
    }
}
