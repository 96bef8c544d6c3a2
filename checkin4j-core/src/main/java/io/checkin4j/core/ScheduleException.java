package io.checkin4j.core;

import java.util.Objects;

/**
 * A schedule expression could not be resolved into a trigger.
 * Raised at install time; the offending account is simply not scheduled.
 */
public class ScheduleException extends CheckinException {

    public enum Reason {
        INVALID_WINDOW,
        INVALID_CRON_ARITY,
        INVALID_CRON_EXPRESSION
    }

    private final Reason reason;

    public ScheduleException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public ScheduleException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason reason() {
        return reason;
    }
}
