package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.types.JobStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class JobStatusArgumentFactory extends AbstractArgumentFactory<JobStatus> {

    public JobStatusArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(JobStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
