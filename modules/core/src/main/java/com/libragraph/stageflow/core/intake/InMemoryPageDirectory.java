package com.libragraph.stageflow.core.intake;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
@IfBuildProperty(name = "stageflow.store.type", stringValue = "memory")
public class InMemoryPageDirectory implements PageDirectory {

    private final Clock clock;
    private final Map<String, Page> byUrl = new HashMap<>();
    private final Map<UUID, Page> byId = new HashMap<>();

    @Inject
    public InMemoryPageDirectory(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Page resolveOrCreate(String url) {
        return byUrl.computeIfAbsent(url, u -> {
            Page page = new Page(UUID.randomUUID(), u, clock.instant());
            byId.put(page.id(), page);
            return page;
        });
    }

    @Override
    public synchronized Optional<Page> find(UUID id) {
        return Optional.ofNullable(byId.get(id));
    }
}
