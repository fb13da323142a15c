package com.libragraph.stageflow.pipelines.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.stageflow.core.stage.StageContext;
import com.libragraph.stageflow.core.stage.StageHandler;
import com.libragraph.stageflow.core.stage.StageResult;

import java.util.List;
import java.util.UUID;

/**
 * Final stage: gathers the outputs of every earlier stage into the job result.
 */
public class CompletionStageHandler implements StageHandler<JsonNode> {

    private final List<String> stages;
    private final ObjectMapper objectMapper;

    public CompletionStageHandler(List<String> stages, ObjectMapper objectMapper) {
        this.stages = stages;
        this.objectMapper = objectMapper;
    }

    @Override
    public String stage() {
        return ContentPipeline.COMPLETE;
    }

    @Override
    public Class<JsonNode> payloadType() {
        return JsonNode.class;
    }

    @Override
    public StageResult handle(UUID jobId, JsonNode payload, StageContext ctx) {
        ObjectNode result = objectMapper.createObjectNode();
        for (String s : stages) {
            if (s.equals(stage())) break;
            ctx.output(s).ifPresent(output -> result.set(s, output));
        }
        ctx.completeJob(result);
        return StageResult.complete();
    }
}
