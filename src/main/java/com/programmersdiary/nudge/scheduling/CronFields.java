package com.programmersdiary.nudge.scheduling;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.SortedSet;

/**
 * Expanded 5-field cron expression. Day-of-week uses 0 for Sunday.
 *
 * <p>A minute matches only when all five fields match, including day-of-month AND day-of-week.
 * This differs from classic cron, which ORs the two day fields when both are restricted.
 */
public record CronFields(
        SortedSet<Integer> minutes,
        SortedSet<Integer> hours,
        SortedSet<Integer> daysOfMonth,
        SortedSet<Integer> months,
        SortedSet<Integer> daysOfWeek) {

    static final Duration SEARCH_HORIZON = Duration.ofDays(4 * 365);

    /**
     * Returns the first matching minute strictly after {@code reference}. Seconds are discarded.
     * If nothing matches within four years the horizon itself is returned.
     */
    public ZonedDateTime nextAfter(ZonedDateTime reference) {
        var candidate = reference.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        var limit = candidate.plus(SEARCH_HORIZON);
        while (candidate.isBefore(limit)) {
            if (matches(candidate)) {
                return candidate;
            }
            candidate = candidate.plusMinutes(1);
        }
        return candidate;
    }

    public boolean matches(ZonedDateTime time) {
        return minutes.contains(time.getMinute())
                && hours.contains(time.getHour())
                && daysOfMonth.contains(time.getDayOfMonth())
                && months.contains(time.getMonthValue())
                && daysOfWeek.contains(time.getDayOfWeek().getValue() % 7);
    }
}
