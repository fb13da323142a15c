package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.types.ItemStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class ItemStatusArgumentFactory extends AbstractArgumentFactory<ItemStatus> {

    public ItemStatusArgumentFactory() {
        super(Types.SMALLINT);
    }

    @Override
    protected Argument build(ItemStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setShort(position, (short) value.id());
    }
}
