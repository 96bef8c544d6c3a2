package io.checkin4j.utils;

import io.checkin4j.core.ScheduleException;
import io.checkin4j.core.ScheduleTrigger;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronSupportTest {

    @Test
    void toQuartzCronShouldPrependSecondsAndUseQuestionMark() {
        assertEquals(List.of("0 0 8 * * ?"), CronSupport.toQuartzCrons(List.of("0", "8", "*", "*", "*")));
        assertEquals(List.of("0 30 9 15 * ?"), CronSupport.toQuartzCrons(List.of("30", "9", "15", "*", "*")));
    }

    @Test
    void dayOfWeekShouldShiftToQuartzNumbering() {
        // Mon-Fri in standard cron is 1-5, in Quartz 2-6
        assertEquals(List.of("0 0 8 ? * 2,3,4,5,6"), CronSupport.toQuartzCrons(List.of("0", "8", "*", "*", "1-5")));
        // 0 and 7 are both Sunday
        assertEquals(List.of("0 0 8 ? * 1"), CronSupport.toQuartzCrons(List.of("0", "8", "*", "*", "0,7")));
        assertEquals(List.of("0 0 8 ? * 1,3,5,7"), CronSupport.toQuartzCrons(List.of("0", "8", "*", "*", "*/2")));
        assertEquals(List.of("0 0 8 ? * MON-FRI"), CronSupport.toQuartzCrons(List.of("0", "8", "*", "*", "MON-FRI")));
    }

    @Test
    void restrictingBothDayFieldsShouldSplitIntoTwoExpressions() {
        assertEquals(List.of("0 0 8 1 * ?", "0 0 8 ? * 2"),
                CronSupport.toQuartzCrons(List.of("0", "8", "1", "*", "1")));
    }

    @Test
    void bothDayFieldsShouldFireOnEitherMatch() {
        CronSchedule schedule = CronSupport.build(ScheduleResolver.resolve("0 9 1 * 1"), ZoneOffset.UTC);

        // Thursday 1 Jan 2026 -> Monday 5 Jan
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), schedule.nextAfter(Instant.parse("2026-01-01T10:00:00Z")));
        // Monday 26 Jan -> Sunday 1 Feb, the 1st comes before Monday 2 Feb
        assertEquals(Instant.parse("2026-02-01T09:00:00Z"), schedule.nextAfter(Instant.parse("2026-01-26T10:00:00Z")));
    }

    @Test
    void requireFiresShouldRejectImpossibleDate() {
        ScheduleException e = assertThrows(ScheduleException.class,
                () -> CronSupport.requireFires(ScheduleResolver.resolve("0 0 30 2 *"), ZoneOffset.UTC,
                        Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals(ScheduleException.Reason.INVALID_CRON_EXPRESSION, e.reason());
    }

    @Test
    void outOfRangeFieldsShouldFailOnBuild() {
        ScheduleTrigger bad = new ScheduleTrigger(List.of("99", "8", "*", "*", "*"), null);
        ScheduleException e = assertThrows(ScheduleException.class, () -> CronSupport.build(bad, ZoneOffset.UTC));
        assertEquals(ScheduleException.Reason.INVALID_CRON_EXPRESSION, e.reason());

        ScheduleTrigger badDay = new ScheduleTrigger(List.of("0", "8", "*", "*", "9"), null);
        ScheduleException dayError = assertThrows(ScheduleException.class, () -> CronSupport.build(badDay, ZoneOffset.UTC));
        assertEquals(ScheduleException.Reason.INVALID_CRON_EXPRESSION, dayError.reason());
    }

    @Test
    void nextFireTimeShouldHonourZone() {
        ScheduleTrigger trigger = new ScheduleTrigger(List.of("0", "8", "*", "*", "*"), null);
        CronSchedule schedule = CronSupport.build(trigger, ZoneId.of("Asia/Shanghai"));

        Instant next = schedule.nextAfter(Instant.parse("2026-01-01T00:30:00Z"));

        // 08:00 in Shanghai is 00:00 UTC, already past, so the next day
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"), next);
    }

    @Test
    void weekdayScheduleShouldSkipWeekend() {
        ScheduleTrigger trigger = new ScheduleTrigger(List.of("0", "8", "*", "*", "1-5"), null);
        CronSchedule schedule = CronSupport.build(trigger, ZoneOffset.UTC);

        // 2026-01-02 is a Friday
        Instant next = schedule.nextAfter(Instant.parse("2026-01-02T09:00:00Z"));

        assertEquals(Instant.parse("2026-01-05T08:00:00Z"), next);
    }
}
