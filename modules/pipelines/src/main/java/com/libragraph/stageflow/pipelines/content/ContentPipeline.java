package com.libragraph.stageflow.pipelines.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.stageflow.core.intake.PreparedIntake;
import com.libragraph.stageflow.core.intake.ValidationException;
import com.libragraph.stageflow.core.stage.PipelineDefinition;
import com.libragraph.stageflow.core.stage.StageHandler;
import com.libragraph.stageflow.pipelines.engine.EngineStageHandler;
import com.libragraph.stageflow.pipelines.engine.StageEngineClient;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.rest.client.inject.RestClient;

import java.util.List;

/**
 * Long-form content generation: research, outline, per-section draft, distribution, completion.
 */
@ApplicationScoped
public class ContentPipeline implements PipelineDefinition {

    public static final String NAME = "content";

    public static final String RESEARCH = "research";
    public static final String OUTLINE = "outline";
    public static final String DRAFT = "draft";
    public static final String DISTRIBUTION = "distribution";
    public static final String COMPLETE = "complete";

    private static final List<String> STAGES = List.of(RESEARCH, OUTLINE, DRAFT, DISTRIBUTION, COMPLETE);

    @Inject
    @RestClient
    StageEngineClient engine;

    @Inject
    ObjectMapper objectMapper;

    private List<StageHandler<?>> handlers;

    public ContentPipeline() {
    }

    public ContentPipeline(StageEngineClient engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
        init();
    }

    @PostConstruct
    void init() {
        handlers = List.of(
                new EngineStageHandler(NAME, RESEARCH, engine, false),
                new EngineStageHandler(NAME, OUTLINE, engine, false),
                new DraftStageHandler(NAME, engine, objectMapper),
                new EngineStageHandler(NAME, DISTRIBUTION, engine, false),
                new CompletionStageHandler(STAGES, objectMapper));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> stages() {
        return STAGES;
    }

    @Override
    public List<StageHandler<?>> handlers() {
        return handlers;
    }

    /** Drafting runs one engine call per section, so a worker takes fewer jobs. */
    @Override
    public int jobsPerWorker(String stage) {
        return DRAFT.equals(stage) ? 5 : 10;
    }

    /**
     * Requires a non-blank {@code topic}. An optional {@code task_id} identifies the
     * upstream content task and deduplicates active jobs.
     */
    @Override
    public PreparedIntake prepareIntake(JsonNode payload) {
        JsonNode topic = payload.get("topic");
        if (topic == null || !topic.isTextual() || topic.asText().isBlank()) {
            throw new ValidationException("topic is required");
        }
        JsonNode taskId = payload.get("task_id");
        String dedupKey = taskId != null && !taskId.isNull() && !taskId.asText().isBlank() ? taskId.asText() : null;
        return new PreparedIntake(payload, dedupKey);
    }
}
