package com.libragraph.stageflow.types;

public enum JobStatus {
    QUEUED(0, "queued"),
    PROCESSING(1, "processing"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed");

    private final int id;
    private final String label;

    JobStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static JobStatus fromId(int id) {
        for (JobStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown JobStatus id: " + id);
    }

    public static JobStatus fromLabel(String label) {
        for (JobStatus s : values()) {
            if (s.label.equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown JobStatus label: " + label);
    }
}
