package com.libragraph.stageflow.pipelines.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.libragraph.stageflow.core.stage.FatalStageException;
import com.libragraph.stageflow.core.stage.RetryableStageException;
import com.libragraph.stageflow.core.stage.StageContext;
import com.libragraph.stageflow.core.stage.StageHandler;
import com.libragraph.stageflow.core.stage.StageResult;
import com.libragraph.stageflow.pipelines.engine.EngineRequest;
import com.libragraph.stageflow.pipelines.engine.EngineResponse;
import com.libragraph.stageflow.pipelines.engine.StageEngineClient;
import com.libragraph.stageflow.types.ItemStatus;
import org.jboss.logging.Logger;

import java.util.UUID;

/**
 * Drafts each outline section with its own engine call.
 *
 * <p>Finished sections are checkpointed into the stage output as they complete, so a
 * redelivered message resumes with the first section that has no draft yet.
 */
public class DraftStageHandler implements StageHandler<DraftPayload> {

    private static final Logger log = Logger.getLogger(DraftStageHandler.class);

    private final String pipeline;
    private final StageEngineClient engine;
    private final ObjectMapper objectMapper;

    public DraftStageHandler(String pipeline, StageEngineClient engine, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    public String stage() {
        return ContentPipeline.DRAFT;
    }

    @Override
    public Class<DraftPayload> payloadType() {
        return DraftPayload.class;
    }

    @Override
    public StageResult handle(UUID jobId, DraftPayload payload, StageContext ctx) {
        if (payload.sections() == null || payload.sections().isEmpty()) {
            throw new FatalStageException("Outline produced no sections for job " + jobId);
        }

        ObjectNode drafts = ctx.output(stage())
                .filter(JsonNode::isObject)
                .map(n -> (ObjectNode) n.deepCopy())
                .orElseGet(objectMapper::createObjectNode);

        for (String section : payload.sections()) {
            if (drafts.has(section)) {
                continue;
            }
            ctx.upsertItem(section, ItemStatus.PROCESSING);
            ObjectNode request = objectMapper.createObjectNode()
                    .put("topic", payload.topic())
                    .put("section", section);
            EngineResponse response = engine.run(pipeline, stage(), new EngineRequest(jobId, ctx.attempt(), request));
            if (response == null || !EngineResponse.COMPLETE.equals(response.status())) {
                ctx.upsertItem(section, ItemStatus.FAILED);
                throw new RetryableStageException("Section '" + section + "' not drafted: "
                        + (response == null ? "no response" : response.status()));
            }
            drafts.set(section, response.output());
            ctx.saveOutput(drafts);
            ctx.upsertItem(section, ItemStatus.COMPLETED);
            ctx.heartbeat();
            log.debugf("Job %s drafted section '%s'", jobId, section);
        }

        ObjectNode next = objectMapper.createObjectNode().put("topic", payload.topic());
        next.set("sections", objectMapper.valueToTree(payload.sections()));
        ctx.advance(next);
        return StageResult.complete();
    }
}
