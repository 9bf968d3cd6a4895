package io.jobgtm.model;

/**
 * Per-stage status of a work item as stored in the {@code *_status} columns.
 */
public enum StageStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wire;

    StageStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    /**
     * @return the matching status, or {@code null} for a stage that has not started
     */
    public static StageStatus fromWire(String value) {
        if (value == null) return null;
        for (StageStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown stage status: " + value);
    }
}
