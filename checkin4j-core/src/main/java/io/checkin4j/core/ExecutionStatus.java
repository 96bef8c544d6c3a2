package io.checkin4j.core;

public enum ExecutionStatus {
    SUCCESS("success"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    /**
     * Lower-case name used in persisted rows and notification payloads.
     */
    public String value() {
        return value;
    }

    public static ExecutionStatus fromValue(String value) {
        for (ExecutionStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown execution status: " + value);
    }
}
