package com.libragraph.stageflow.core.stage;

/**
 * The message payload does not match the stage's payload type.
 */
public class PayloadValidationException extends FatalStageException {

    public PayloadValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
