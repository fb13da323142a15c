package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.types.ItemStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class ItemStatusColumnMapper implements ColumnMapper<ItemStatus> {

    @Override
    public ItemStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        return ItemStatus.fromId(r.getShort(columnNumber));
    }
}
