package com.libragraph.stageflow.core.stage;

import com.libragraph.stageflow.core.config.QueueSettings;

import java.util.Objects;

/**
 * Everything a runner needs to process one stage: the queue, the stage it accepts,
 * the resolved settings and the handler.
 */
public record StageBinding(
        PipelineDefinition pipeline,
        String stage,
        QueueSettings settings,
        StageHandler<?> handler
) {
    public StageBinding {
        Objects.requireNonNull(pipeline, "pipeline cannot be null");
        Objects.requireNonNull(settings, "settings cannot be null");
        Objects.requireNonNull(handler, "handler cannot be null");
        if (!handler.stage().equals(stage)) {
            throw new IllegalArgumentException(
                    "Handler " + handler.getClass().getName() + " serves '" + handler.stage() + "', not '" + stage + "'");
        }
    }

    public String queue() {
        return pipeline.name();
    }

    /** Worker name used by the HTTP trigger, e.g. {@code content-research}. */
    public String workerName() {
        return pipeline.name() + "-" + stage;
    }

    public int jobsPerWorker() {
        return pipeline.jobsPerWorker(stage);
    }
}
