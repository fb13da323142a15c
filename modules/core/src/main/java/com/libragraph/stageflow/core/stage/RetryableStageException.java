package com.libragraph.stageflow.core.stage;

/**
 * Transient failure: the stage is redelivered while attempts remain.
 */
public class RetryableStageException extends StageException {

    public RetryableStageException(String message) {
        super(message);
    }

    public RetryableStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
