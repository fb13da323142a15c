package com.libragraph.stageflow.core.dao;

import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.List;

public interface DatabaseDao {

    @SqlQuery("SELECT version()")
    String serverVersion();

    @SqlQuery("SELECT 1")
    int ping();

    /** Names from {@code tables} that have no table in the current schema. */
    @SqlQuery("""
            SELECT t FROM unnest(ARRAY[<tables>]::text[]) AS t
            WHERE to_regclass(t) IS NULL
            ORDER BY t
            """)
    List<String> missingTables(@BindList("tables") List<String> tables);
}
