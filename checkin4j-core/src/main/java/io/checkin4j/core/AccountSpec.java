package io.checkin4j.core;

import java.util.Objects;

/**
 * A user-defined check-in: the raw request spec plus when and how persistently to run it.
 * Owned by the account store; read-only to the scheduler and engine.
 */
public record AccountSpec(

        // identity
        String id,
        String name,

        // what to run
        String rawSpec,

        // when to run
        String scheduleExpr,

        // retry policy
        int retryCount,
        int retryIntervalSeconds,

        boolean enabled
) {
    public static final String DEFAULT_SCHEDULE = "0 8 * * *";
    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final int DEFAULT_RETRY_INTERVAL_SECONDS = 60;

    public AccountSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(rawSpec, "rawSpec must not be null");
        if (scheduleExpr == null || scheduleExpr.isBlank()) {
            scheduleExpr = DEFAULT_SCHEDULE;
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        if (retryIntervalSeconds < 0) {
            throw new IllegalArgumentException("retryIntervalSeconds must not be negative");
        }
    }

    /**
     * New enabled account with the default retry policy.
     */
    public static AccountSpec of(String id, String name, String rawSpec, String scheduleExpr) {
        return new AccountSpec(id, name, rawSpec, scheduleExpr,
                DEFAULT_RETRY_COUNT, DEFAULT_RETRY_INTERVAL_SECONDS, true);
    }

    public AccountSpec withId(String newId) {
        return new AccountSpec(newId, name, rawSpec, scheduleExpr, retryCount, retryIntervalSeconds, enabled);
    }

    public AccountSpec withEnabled(boolean newEnabled) {
        return new AccountSpec(id, name, rawSpec, scheduleExpr, retryCount, retryIntervalSeconds, newEnabled);
    }

    public AccountSpec withRetry(int newRetryCount, int newRetryIntervalSeconds) {
        return new AccountSpec(id, name, rawSpec, scheduleExpr, newRetryCount, newRetryIntervalSeconds, enabled);
    }
}
