package com.libragraph.stageflow.core.stage;

import java.util.UUID;

/**
 * The unit of work for one stage of a pipeline.
 *
 * <p>Delivery is at-least-once, so the same {@code (jobId, stage)} may be handled more than
 * once, occasionally concurrently after a lease expires. Every side effect must be safe to
 * repeat: write through {@link StageContext#saveOutput} and {@link StageContext#upsertItem},
 * and transition the job only through {@link StageContext#advance} or
 * {@link StageContext#completeJob}, which are conditional on the current stage.
 *
 * <p>Throw {@link FatalStageException} for input that can never succeed and
 * {@link RetryableStageException} for transient failures; see {@link StageError#from} for how
 * other exceptions are classified.
 *
 * @param <P> typed stage payload, converted from the message JSON before {@link #handle} runs
 */
public interface StageHandler<P> {

    String stage();

    Class<P> payloadType();

    StageResult handle(UUID jobId, P payload, StageContext ctx) throws Exception;
}
