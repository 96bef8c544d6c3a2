package io.checkin4j.utils;

import io.checkin4j.core.ScheduleException;
import io.checkin4j.core.ScheduleTrigger;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds Quartz {@link CronExpression}s from standard 5-field cron.
 * <p>
 * Differences handled:
 * <ul>
 *   <li>Quartz has a leading seconds field: "0" is prepended.</li>
 *   <li>Quartz needs "?" in one of the two day fields.</li>
 *   <li>Day-of-week is 0-7 with 0 and 7 both Sunday in standard cron, 1-7 with 1 = Sunday in Quartz.</li>
 *   <li>When both day fields are restricted standard cron fires on either; that becomes two Quartz
 *       expressions, one per day field.</li>
 * </ul>
 */
public final class CronSupport {
    private CronSupport() {
    }

    /**
     * @return one Quartz expression, or two when both day fields are restricted
     */
    public static List<String> toQuartzCrons(List<String> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        if (fields.size() != 5) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_ARITY,
                    "Cron expression must have exactly 5 fields, got " + fields.size());
        }

        String min = fields.get(0);
        String hour = fields.get(1);
        String dom = fields.get(2);
        String month = fields.get(3);
        String dow = fields.get(4);

        if (isUnrestricted(dow)) {
            return List.of(quartz(min, hour, dom, month, "?"));
        }
        if (isUnrestricted(dom)) {
            return List.of(quartz(min, hour, "?", month, convertDayOfWeek(dow)));
        }
        return List.of(
                quartz(min, hour, dom, month, "?"),
                quartz(min, hour, "?", month, convertDayOfWeek(dow)));
    }

    /**
     * Builds the trigger's schedule in the given zone.
     *
     * @throws ScheduleException with {@code INVALID_CRON_EXPRESSION} when Quartz rejects a field
     */
    public static CronSchedule build(ScheduleTrigger trigger, ZoneId zone) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        List<CronExpression> expressions = new ArrayList<>(2);
        for (String cron : toQuartzCrons(trigger.cronFields())) {
            CronExpression exp;
            try {
                exp = new CronExpression(cron);
            } catch (ParseException e) {
                throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_EXPRESSION,
                        "Invalid cron expression: " + trigger.cronExpression() + " (" + e.getMessage() + ")", e);
            }
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            expressions.add(exp);
        }
        return new CronSchedule(expressions);
    }

    /**
     * Builds the schedule and checks that it fires at least once after {@code now}.
     *
     * @throws ScheduleException with {@code INVALID_CRON_EXPRESSION} for a bad or never-firing expression
     */
    public static CronSchedule requireFires(ScheduleTrigger trigger, ZoneId zone, Instant now) {
        CronSchedule schedule = build(trigger, zone);
        if (schedule.nextAfter(now) == null) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_EXPRESSION,
                    "Cron expression never fires: " + trigger.cronExpression());
        }
        return schedule;
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    private static String quartz(String min, String hour, String dom, String month, String dow) {
        return String.join(" ", "0", min, hour, dom, month, dow);
    }

    private static String convertDayOfWeek(String field) {
        // names (MON-FRI) and Quartz-only forms (L, #) are the same in both dialects
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (Character.isLetter(c) || c == '#') {
                return field;
            }
        }

        TreeSet<Integer> days = new TreeSet<>();
        for (String item : field.split(",")) {
            String base = item;
            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = parseDay(item.substring(slash + 1), field);
                if (step <= 0) {
                    throw invalidDayOfWeek(field);
                }
            }

            int from;
            int to;
            if ("*".equals(base)) {
                from = 0;
                to = 6;
            } else if (base.contains("-")) {
                String[] range = base.split("-", 2);
                from = parseDay(range[0], field);
                to = parseDay(range[1], field);
            } else {
                from = parseDay(base, field);
                to = slash >= 0 ? 7 : from;
            }
            if (from > to) {
                throw invalidDayOfWeek(field);
            }
            for (int d = from; d <= to; d += step) {
                days.add(d % 7 + 1);
            }
        }
        return days.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static int parseDay(String value, String field) {
        int day;
        try {
            day = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_EXPRESSION,
                    "Invalid day-of-week field: " + field, e);
        }
        if (day < 0 || day > 7) {
            throw invalidDayOfWeek(field);
        }
        return day;
    }

    private static ScheduleException invalidDayOfWeek(String field) {
        return new ScheduleException(ScheduleException.Reason.INVALID_CRON_EXPRESSION,
                "Invalid day-of-week field: " + field);
    }
}
