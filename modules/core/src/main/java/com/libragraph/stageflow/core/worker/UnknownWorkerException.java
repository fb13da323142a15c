package com.libragraph.stageflow.core.worker;

public class UnknownWorkerException extends RuntimeException {

    private final String worker;

    public UnknownWorkerException(String worker) {
        super("Unknown worker: " + worker);
        this.worker = worker;
    }

    public String worker() {
        return worker;
    }
}
