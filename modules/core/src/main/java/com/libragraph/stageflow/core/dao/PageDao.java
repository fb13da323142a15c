package com.libragraph.stageflow.core.dao;

import com.libragraph.stageflow.core.intake.Page;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(Page.class)
public interface PageDao {

    /** The no-op update makes RETURNING yield the existing row on conflict. */
    @SqlQuery("INSERT INTO page (id, url) VALUES (:id, :url) " +
            "ON CONFLICT (url) DO UPDATE SET url = EXCLUDED.url " +
            "RETURNING id, url, created_at")
    Page upsert(@Bind("id") UUID id, @Bind("url") String url);

    @SqlQuery("SELECT id, url, created_at FROM page WHERE id = :id")
    Optional<Page> findById(@Bind("id") UUID id);
}
