package com.libragraph.stageflow.core.job;

/**
 * The job store could not be reached or rejected an operation.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
