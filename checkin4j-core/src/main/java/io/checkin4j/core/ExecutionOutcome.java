package io.checkin4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Terminal result of one {@code ExecutionEngine.run} call.
 *
 * <p>{@code attempts} is the number of HTTP attempts performed (0 when nothing was sent) and
 * {@code logId} the id of the last audit row written for this run, if any.
 */
public record ExecutionOutcome(
        String accountId,
        ExecutionStatus status,
        Integer responseCode,
        String responseBody,
        String errorMessage,
        Instant timestamp,
        int attempts,
        String logId
) {
    public static final int MAX_BODY_LENGTH = 5000;
    public static final int MAX_ERROR_LENGTH = 500;

    public ExecutionOutcome {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        responseBody = truncate(responseBody, MAX_BODY_LENGTH);
        errorMessage = truncate(errorMessage, MAX_ERROR_LENGTH);
    }

    public static ExecutionOutcome skipped(String accountId, String message, Instant at) {
        return new ExecutionOutcome(accountId, ExecutionStatus.SKIPPED, null, null, message, at, 0, null);
    }

    public static ExecutionOutcome failed(String accountId, String message, Instant at) {
        return new ExecutionOutcome(accountId, ExecutionStatus.FAILED, null, null, message, at, 0, null);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public static String truncate(String s, int max) {
        if (s == null || s.length() <= max) {
            return s;
        }
        return s.substring(0, max);
    }
}
