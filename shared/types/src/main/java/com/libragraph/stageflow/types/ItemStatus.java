package com.libragraph.stageflow.types;

/**
 * Status of a child record owned by a job (a draft section, a sub-queue entry).
 */
public enum ItemStatus {
    PENDING(0, "pending"),
    PROCESSING(1, "processing"),
    COMPLETED(2, "completed"),
    FAILED(3, "failed");

    private final int id;
    private final String label;

    ItemStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ItemStatus fromId(int id) {
        for (ItemStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown ItemStatus id: " + id);
    }
}
