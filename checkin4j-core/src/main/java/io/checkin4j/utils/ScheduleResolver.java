package io.checkin4j.utils;

import io.checkin4j.core.ScheduleException;
import io.checkin4j.core.ScheduleTrigger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves schedule expressions into a {@link ScheduleTrigger}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Standard 5-field cron: "0 8 * * *" (minute hour day-of-month month day-of-week)</li>
 *   <li>Random window: "R(09:00-09:30) * * *" fires at the window start, then waits a random
 *       delay of up to the window length</li>
 * </ul>
 * <p>
 * Field ranges are not checked here; {@link CronSupport} validates them when the trigger is built.
 */
public final class ScheduleResolver {
    private ScheduleResolver() {
    }

    private static final Pattern RANDOM_WINDOW =
            Pattern.compile("^R\\((\\d{1,2}):(\\d{2})-(\\d{1,2}):(\\d{2})\\)\\s+(.+)$");

    public static ScheduleTrigger resolve(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_ARITY,
                    "Schedule expression must not be empty");
        }
        String s = expr.trim();

        Matcher m = RANDOM_WINDOW.matcher(s);
        if (!m.matches()) {
            return new ScheduleTrigger(splitFields(s, s), null);
        }

        int startHour = Integer.parseInt(m.group(1));
        int startMinute = Integer.parseInt(m.group(2));
        int endHour = Integer.parseInt(m.group(3));
        int endMinute = Integer.parseInt(m.group(4));

        if (!isTimeOfDay(startHour, startMinute)) {
            throw invalidWindow("Invalid window start " + m.group(1) + ":" + m.group(2) + " in: " + expr);
        }
        if (!isTimeOfDay(endHour, endMinute)) {
            throw invalidWindow("Invalid window end " + m.group(3) + ":" + m.group(4) + " in: " + expr);
        }

        int start = startHour * 60 + startMinute;
        int end = endHour * 60 + endMinute;
        if (end <= start) {
            throw invalidWindow("Window end must be after window start (windows cannot cross midnight): " + expr);
        }

        String standard = startMinute + " " + startHour + " " + m.group(5).trim();
        return new ScheduleTrigger(splitFields(standard, s), (end - start) * 60);
    }

    private static List<String> splitFields(String cron, String original) {
        String[] parts = cron.trim().split("\\s+");
        if (parts.length != 5) {
            throw new ScheduleException(ScheduleException.Reason.INVALID_CRON_ARITY,
                    "Cron expression must have exactly 5 fields (minute hour day month weekday), got "
                            + parts.length + ": " + original);
        }
        return new ArrayList<>(Arrays.asList(parts));
    }

    private static boolean isTimeOfDay(int hour, int minute) {
        return hour >= 0 && hour <= 23 && minute >= 0 && minute <= 59;
    }

    private static ScheduleException invalidWindow(String message) {
        return new ScheduleException(ScheduleException.Reason.INVALID_WINDOW, message);
    }
}
