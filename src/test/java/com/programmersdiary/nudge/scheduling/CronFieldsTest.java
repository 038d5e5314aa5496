package com.programmersdiary.nudge.scheduling;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CronFieldsTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Vilnius");

    private static ZonedDateTime at(int year, int month, int day, int hour, int minute, int second) {
        return ZonedDateTime.of(year, month, day, hour, minute, second, 0, ZONE);
    }

    @Test
    void nextOccurrenceLaterSameDay() {
        var fields = ScheduleParser.parseCron("0 9 * * *");

        assertThat(fields.nextAfter(at(2025, 6, 15, 8, 30, 0))).isEqualTo(at(2025, 6, 15, 9, 0, 0));
    }

    @Test
    void nextOccurrenceRollsToNextDay() {
        var fields = ScheduleParser.parseCron("0 9 * * *");

        assertThat(fields.nextAfter(at(2025, 6, 15, 9, 30, 0))).isEqualTo(at(2025, 6, 16, 9, 0, 0));
    }

    @Test
    void resultIsStrictlyAfterReferenceEvenOnExactMatch() {
        var fields = ScheduleParser.parseCron("0 9 * * *");

        assertThat(fields.nextAfter(at(2025, 6, 15, 9, 0, 0))).isEqualTo(at(2025, 6, 16, 9, 0, 0));
    }

    @Test
    void secondsAreTruncated() {
        var fields = ScheduleParser.parseCron("* * * * *");
        var reference = at(2025, 6, 15, 8, 30, 45).plusNanos(123_000);

        assertThat(fields.nextAfter(reference)).isEqualTo(at(2025, 6, 15, 8, 31, 0));
    }

    @Test
    void rollsOverMonthAndYear() {
        var fields = ScheduleParser.parseCron("0 0 1 * *");

        assertThat(fields.nextAfter(at(2025, 12, 31, 23, 59, 0))).isEqualTo(at(2026, 1, 1, 0, 0, 0));
    }

    @Test
    void skipsMonthsWithoutTheDay() {
        var fields = ScheduleParser.parseCron("0 12 31 * *");

        assertThat(fields.nextAfter(at(2025, 4, 1, 0, 0, 0))).isEqualTo(at(2025, 5, 31, 12, 0, 0));
    }

    @Test
    void findsLeapDay() {
        var fields = ScheduleParser.parseCron("0 0 29 2 *");

        assertThat(fields.nextAfter(at(2025, 3, 1, 0, 0, 0))).isEqualTo(at(2028, 2, 29, 0, 0, 0));
    }

    @Test
    void weekdayRangeSkipsWeekend() {
        var fields = ScheduleParser.parseCron("0 9 * * 1-5");

        // 2025-06-14 is a Saturday
        assertThat(fields.nextAfter(at(2025, 6, 14, 10, 0, 0))).isEqualTo(at(2025, 6, 16, 9, 0, 0));
    }

    @Test
    void sundayIsZero() {
        var fields = ScheduleParser.parseCron("0 8 * * 0");

        assertThat(fields.nextAfter(at(2025, 6, 10, 0, 0, 0))).isEqualTo(at(2025, 6, 15, 8, 0, 0));
    }

    @Test
    void dayOfMonthAndDayOfWeekMustBothMatch() {
        // The 13th that is also a Friday; classic cron would fire on every 13th and every Friday.
        var fields = ScheduleParser.parseCron("0 0 13 * 5");

        assertThat(fields.nextAfter(at(2025, 6, 14, 0, 0, 0))).isEqualTo(at(2026, 2, 13, 0, 0, 0));
    }

    @Test
    void returnsHorizonWhenNothingMatches() {
        // February 30th never exists.
        var fields = ScheduleParser.parseCron("0 0 30 2 *");
        var reference = at(2025, 1, 1, 0, 0, 0);

        var next = fields.nextAfter(reference);

        assertThat(next).isEqualTo(reference.plusMinutes(1).plus(CronFields.SEARCH_HORIZON));
    }

    @Test
    void triggerComputesNextExecutionFromCurrentTime() {
        var fields = ScheduleParser.parseCron("*/15 * * * *");
        var clock = Clock.fixed(at(2025, 6, 15, 10, 7, 30).toInstant(), ZONE);
        var trigger = new CronSchedule.CronFieldsTrigger(fields);

        var next = trigger.nextExecution(new SimpleTriggerContext(clock));

        assertThat(next).isEqualTo(at(2025, 6, 15, 10, 15, 0).toInstant());
    }

    @Test
    void triggerDoesNotRepeatOccurrenceWhenFireCompletesEarly() {
        var fields = ScheduleParser.parseCron("0 9 * * *");
        var scheduled = at(2025, 6, 15, 9, 0, 0).toInstant();
        var early = scheduled.minusMillis(1);
        var context = new SimpleTriggerContext(Clock.fixed(early, ZONE));
        context.update(scheduled, early, early);
        var trigger = new CronSchedule.CronFieldsTrigger(fields);

        assertThat(trigger.nextExecution(context)).isEqualTo(at(2025, 6, 16, 9, 0, 0).toInstant());
    }
}
