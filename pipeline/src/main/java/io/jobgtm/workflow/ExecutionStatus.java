package io.jobgtm.workflow;

public enum ExecutionStatus {
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    /** Was running when the owning process died. */
    INTERRUPTED("interrupted");

    private final String wire;

    ExecutionStatus(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static ExecutionStatus fromWire(String value) {
        for (ExecutionStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
