package com.libragraph.stageflow.core.intake;

/**
 * Caller input was rejected. Surfaces as HTTP 400 and never mutates job state.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
