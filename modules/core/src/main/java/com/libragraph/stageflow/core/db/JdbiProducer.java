package com.libragraph.stageflow.core.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.dao.ItemStatusArgumentFactory;
import com.libragraph.stageflow.core.dao.ItemStatusColumnMapper;
import com.libragraph.stageflow.core.dao.JobStatusArgumentFactory;
import com.libragraph.stageflow.core.dao.JobStatusColumnMapper;
import io.agroal.api.AgroalDataSource;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.jackson2.Jackson2Config;
import org.jdbi.v3.jackson2.Jackson2Plugin;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

import javax.sql.DataSource;

@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "postgres", enableIfMissing = true)
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource, ObjectMapper objectMapper) {
        return configure(dataSource, objectMapper);
    }

    /** Builds a Jdbi with the plugins, status codecs and SQL logging every DAO relies on. */
    public static Jdbi configure(DataSource dataSource, ObjectMapper objectMapper) {
        Jdbi jdbi = Jdbi.create(dataSource)
                .installPlugin(new PostgresPlugin())
                .installPlugin(new SqlObjectPlugin())
                .installPlugin(new Jackson2Plugin())
                .registerArgument(new JobStatusArgumentFactory())
                .registerColumnMapper(new JobStatusColumnMapper())
                .registerArgument(new ItemStatusArgumentFactory())
                .registerColumnMapper(new ItemStatusColumnMapper())
                .setSqlLogger(new Slf4JSqlLogger());
        jdbi.getConfig(Jackson2Config.class).setMapper(objectMapper);
        return jdbi;
    }
}
