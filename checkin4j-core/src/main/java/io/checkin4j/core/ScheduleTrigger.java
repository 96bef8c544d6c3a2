package io.checkin4j.core;

import java.util.List;
import java.util.Objects;

/**
 * Resolved schedule: five standard cron fields (minute, hour, day-of-month, month, day-of-week)
 * plus an optional upper bound, in seconds, for the random delay applied after each fire.
 */
public record ScheduleTrigger(List<String> cronFields, Integer jitterSeconds) {

    public ScheduleTrigger {
        Objects.requireNonNull(cronFields, "cronFields must not be null");
        if (cronFields.size() != 5) {
            throw new IllegalArgumentException("cronFields must contain exactly 5 fields");
        }
        cronFields = List.copyOf(cronFields);
        if (jitterSeconds != null && jitterSeconds <= 0) {
            throw new IllegalArgumentException("jitterSeconds must be positive when present");
        }
    }

    public String cronExpression() {
        return String.join(" ", cronFields);
    }

    public boolean hasJitter() {
        return jitterSeconds != null;
    }
}
