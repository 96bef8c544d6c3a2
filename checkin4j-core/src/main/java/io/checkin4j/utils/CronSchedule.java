package io.checkin4j.utils;

import org.quartz.CronExpression;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * A standard cron schedule backed by one or two Quartz expressions. Two are used when both
 * day-of-month and day-of-week are restricted: the schedule fires when either matches.
 * <p>
 * Quartz expressions are not thread-safe, so evaluation is synchronized.
 */
public final class CronSchedule {

    private final List<CronExpression> expressions;

    CronSchedule(List<CronExpression> expressions) {
        Objects.requireNonNull(expressions, "expressions must not be null");
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("expressions must not be empty");
        }
        this.expressions = List.copyOf(expressions);
    }

    /**
     * @return the earliest fire strictly after {@code after}, or {@code null} if it never fires again
     */
    public synchronized Instant nextAfter(Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        Instant earliest = null;
        for (CronExpression exp : expressions) {
            Date next = exp.getNextValidTimeAfter(Date.from(after));
            if (next != null && (earliest == null || next.toInstant().isBefore(earliest))) {
                earliest = next.toInstant();
            }
        }
        return earliest;
    }

    List<CronExpression> expressions() {
        return expressions;
    }
}
