package com.libragraph.stageflow.core.stage;

/**
 * Base class for failures a stage handler raises deliberately.
 */
public abstract class StageException extends RuntimeException {

    protected StageException(String message) {
        super(message);
    }

    protected StageException(String message, Throwable cause) {
        super(message, cause);
    }
}
