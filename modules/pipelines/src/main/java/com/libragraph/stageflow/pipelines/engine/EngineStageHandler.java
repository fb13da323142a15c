package com.libragraph.stageflow.pipelines.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.stageflow.core.stage.FatalStageException;
import com.libragraph.stageflow.core.stage.RetryableStageException;
import com.libragraph.stageflow.core.stage.StageContext;
import com.libragraph.stageflow.core.stage.StageHandler;
import com.libragraph.stageflow.core.stage.StageResult;
import com.libragraph.stageflow.types.ItemStatus;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Delegates a stage to the stage engine and applies its reply: store the output, record
 * child items, then advance or complete the job.
 *
 * <p>Engine HTTP errors propagate unchanged and are classified by the runner
 * (429 and 5xx retry, other 4xx fail the job).
 */
public class EngineStageHandler implements StageHandler<JsonNode> {

    private static final Logger log = Logger.getLogger(EngineStageHandler.class);

    static final Duration DEFAULT_RECHECK = Duration.ofSeconds(60);

    private final String pipeline;
    private final String stage;
    private final StageEngineClient engine;
    private final boolean lastStage;

    public EngineStageHandler(String pipeline, String stage, StageEngineClient engine, boolean lastStage) {
        this.pipeline = pipeline;
        this.stage = stage;
        this.engine = engine;
        this.lastStage = lastStage;
    }

    @Override
    public String stage() {
        return stage;
    }

    @Override
    public Class<JsonNode> payloadType() {
        return JsonNode.class;
    }

    @Override
    public StageResult handle(UUID jobId, JsonNode payload, StageContext ctx) {
        EngineResponse response = engine.run(pipeline, stage, new EngineRequest(jobId, ctx.attempt(), payload));
        if (response == null || response.status() == null) {
            throw new RetryableStageException("Stage engine returned no status for " + pipeline + "/" + stage);
        }

        switch (response.status()) {
            case EngineResponse.COMPLETE:
                if (response.output() != null) {
                    ctx.saveOutput(response.output());
                }
                if (response.items() != null) {
                    for (String item : response.items()) {
                        ctx.upsertItem(item, ItemStatus.COMPLETED);
                    }
                }
                JsonNode next = Optional.ofNullable(response.nextPayload()).orElse(payload);
                boolean moved = lastStage ? ctx.completeJob(response.output()) : ctx.advance(next);
                if (!moved) {
                    log.debugf("Job %s already moved past %s/%s", jobId, pipeline, stage);
                }
                return StageResult.complete();
            case EngineResponse.PENDING:
                return StageResult.pending();
            case EngineResponse.RECHECK:
                return StageResult.recheckAfter(response.recheckAfterSeconds() != null
                        ? Duration.ofSeconds(response.recheckAfterSeconds())
                        : DEFAULT_RECHECK);
            case EngineResponse.FAILED:
                throw new FatalStageException("Stage engine failed " + pipeline + "/" + stage + ": "
                        + Optional.ofNullable(response.error()).orElse("no detail"));
            default:
                throw new FatalStageException("Unknown stage engine status '" + response.status() + "'");
        }
    }
}
