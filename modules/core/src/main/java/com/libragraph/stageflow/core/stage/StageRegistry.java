package com.libragraph.stageflow.core.stage;

import com.libragraph.stageflow.core.config.PipelineSettings;
import com.libragraph.stageflow.core.config.QueueSettings;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Discovers {@link PipelineDefinition} beans and binds each stage to its handler and settings.
 */
@ApplicationScoped
public class StageRegistry {

    private static final Logger log = Logger.getLogger(StageRegistry.class);

    @Inject
    Instance<PipelineDefinition> definitions;

    @Inject
    PipelineSettings settings;

    private final Map<String, PipelineDefinition> pipelines = new LinkedHashMap<>();
    private final Map<String, StageBinding> workers = new LinkedHashMap<>();

    @PostConstruct
    void init() {
        for (PipelineDefinition definition : definitions) {
            register(definition, settings.forPipeline(definition.name()));
        }
        log.infof("StageRegistry initialized with %d pipelines, %d workers", pipelines.size(), workers.size());
    }

    /** Registers a pipeline. Every stage must have exactly one handler. */
    public void register(PipelineDefinition definition, QueueSettings queueSettings) {
        PipelineDefinition existing = pipelines.put(definition.name(), definition);
        if (existing != null) {
            throw new IllegalStateException("Duplicate pipeline '" + definition.name() + "': " +
                    existing.getClass().getName() + " and " + definition.getClass().getName());
        }

        Map<String, StageHandler<?>> byStage = new LinkedHashMap<>();
        for (StageHandler<?> handler : definition.handlers()) {
            if (!definition.stages().contains(handler.stage())) {
                throw new IllegalStateException("Handler " + handler.getClass().getName() +
                        " serves unknown stage '" + handler.stage() + "' of " + definition.name());
            }
            if (byStage.put(handler.stage(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for stage '" + handler.stage() +
                        "' of " + definition.name());
            }
        }

        for (String stage : definition.stages()) {
            StageHandler<?> handler = byStage.get(stage);
            if (handler == null) {
                throw new IllegalStateException("No handler for stage '" + stage + "' of " + definition.name());
            }
            StageBinding binding = new StageBinding(definition, stage, queueSettings, handler);
            workers.put(binding.workerName(), binding);
            log.infof("Registered worker: %s → %s", binding.workerName(), handler.getClass().getSimpleName());
        }
    }

    public Optional<StageBinding> worker(String workerName) {
        return Optional.ofNullable(workers.get(workerName));
    }

    public Optional<StageBinding> binding(String pipeline, String stage) {
        return worker(pipeline + "-" + stage);
    }

    public Optional<PipelineDefinition> pipeline(String name) {
        return Optional.ofNullable(pipelines.get(name));
    }

    public Collection<PipelineDefinition> pipelines() {
        return pipelines.values();
    }

    /** Bindings of {@code pipeline} in stage order. */
    public List<StageBinding> bindings(String pipeline) {
        List<StageBinding> result = new ArrayList<>();
        for (StageBinding b : workers.values()) {
            if (b.queue().equals(pipeline)) {
                result.add(b);
            }
        }
        return result;
    }

    public Collection<StageBinding> workers() {
        return workers.values();
    }
}
