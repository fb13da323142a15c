package com.libragraph.stageflow.types;

public enum AlertSeverity {
    WARNING("warning", HealthStatus.DEGRADED),
    CRITICAL("critical", HealthStatus.UNHEALTHY);

    private final String label;
    private final HealthStatus impact;

    AlertSeverity(String label, HealthStatus impact) {
        this.label = label;
        this.impact = impact;
    }

    public String label() {
        return label;
    }

    /** Health status an alert of this severity pushes the pipeline to. */
    public HealthStatus impact() {
        return impact;
    }
}
