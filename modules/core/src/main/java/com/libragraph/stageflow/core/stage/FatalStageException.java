package com.libragraph.stageflow.core.stage;

/**
 * Permanent failure: the job fails immediately without using its remaining attempts.
 */
public class FatalStageException extends StageException {

    public FatalStageException(String message) {
        super(message);
    }

    public FatalStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
