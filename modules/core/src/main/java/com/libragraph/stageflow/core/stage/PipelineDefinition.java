package com.libragraph.stageflow.core.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.stageflow.core.intake.PreparedIntake;

import java.util.List;
import java.util.Optional;

/**
 * A named pipeline: its ordered stages, the handler for each stage, and the pipeline-specific
 * policies for intake, scaling and rescue.
 *
 * <p>Implementations must be {@code @ApplicationScoped} CDI beans; {@link StageRegistry}
 * discovers them at startup.
 */
public interface PipelineDefinition {

    /** Pipeline name, also the queue name. */
    String name();

    /** Stages in execution order. */
    List<String> stages();

    List<StageHandler<?>> handlers();

    /** Backlog a single worker invocation is expected to drain. */
    default int jobsPerWorker(String stage) {
        return 10;
    }

    /**
     * Stage a stale job resumes at. Defaults to the stage it was interrupted in.
     */
    default String rescueStage(String stage) {
        return stage;
    }

    /**
     * Validates an intake payload and resolves any external entity it references.
     *
     * @throws com.libragraph.stageflow.core.intake.ValidationException when the payload is unusable
     */
    default PreparedIntake prepareIntake(JsonNode payload) {
        return new PreparedIntake(payload, null);
    }

    default String firstStage() {
        return stages().get(0);
    }

    default Optional<String> nextStage(String stage) {
        List<String> stages = stages();
        int i = stages.indexOf(stage);
        if (i < 0) {
            throw new IllegalArgumentException("Unknown stage '" + stage + "' in pipeline " + name());
        }
        return i + 1 < stages.size() ? Optional.of(stages.get(i + 1)) : Optional.empty();
    }
}
