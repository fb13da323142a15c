package com.libragraph.stageflow.core.intake;

import com.libragraph.stageflow.core.dao.PageDao;
import com.libragraph.stageflow.core.job.StoreException;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;

import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "postgres", enableIfMissing = true)
public class JdbiPageDirectory implements PageDirectory {

    @Inject
    Jdbi jdbi;

    @Override
    public Page resolveOrCreate(String url) {
        try {
            return jdbi.withExtension(PageDao.class, dao -> dao.upsert(UUID.randomUUID(), url));
        } catch (JdbiException e) {
            throw new StoreException("Page lookup failed for " + url, e);
        }
    }

    @Override
    public Optional<Page> find(UUID id) {
        try {
            return jdbi.withExtension(PageDao.class, dao -> dao.findById(id));
        } catch (JdbiException e) {
            throw new StoreException("Page lookup failed for " + id, e);
        }
    }
}
