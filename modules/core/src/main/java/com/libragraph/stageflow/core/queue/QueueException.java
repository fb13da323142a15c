package com.libragraph.stageflow.core.queue;

/**
 * The durable queue could not be reached or rejected an operation.
 */
public class QueueException extends RuntimeException {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
