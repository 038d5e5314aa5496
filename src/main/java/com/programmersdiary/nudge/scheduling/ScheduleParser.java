package com.programmersdiary.nudge.scheduling;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Parses job schedules. Two forms are accepted:
 * <ul>
 *     <li>{@code @every <duration>}, e.g. {@code @every 5m} or {@code @every 1h30m}</li>
 *     <li>a 5-field cron expression: minute, hour, day-of-month, month, day-of-week</li>
 * </ul>
 * Cron fields are comma-separated lists of {@code *}, {@code n} or {@code lo-hi}, each optionally
 * followed by {@code /step}.
 */
public final class ScheduleParser {

    static final String INTERVAL_PREFIX = "@every ";

    private static final Pattern DURATION = Pattern.compile("(?:\\d+(?:ns|us|µs|ms|s|m|h))+");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+)(ns|us|µs|ms|s|m|h)");
    private static final Map<String, ChronoUnit> UNITS = Map.of(
            "ns", ChronoUnit.NANOS,
            "us", ChronoUnit.MICROS,
            "µs", ChronoUnit.MICROS,
            "ms", ChronoUnit.MILLIS,
            "s", ChronoUnit.SECONDS,
            "m", ChronoUnit.MINUTES,
            "h", ChronoUnit.HOURS);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ScheduleParser() {
    }

    /**
     * Tries the interval form first and falls back to cron.
     *
     * @throws InvalidScheduleException if neither form accepts {@code expression}
     */
    public static Schedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Schedule must not be empty");
        }
        var trimmed = expression.trim();
        if (trimmed.startsWith(INTERVAL_PREFIX)) {
            return new IntervalSchedule(parseInterval(trimmed));
        }
        return new CronSchedule(parseCron(trimmed));
    }

    public static Duration parseInterval(String expression) {
        var trimmed = expression.trim();
        if (!trimmed.startsWith(INTERVAL_PREFIX)) {
            throw new InvalidScheduleException("Not an interval schedule: \"" + expression + "\"");
        }
        var text = trimmed.substring(INTERVAL_PREFIX.length()).trim();
        if (!DURATION.matcher(text).matches()) {
            throw new InvalidScheduleException("Invalid duration \"" + text + "\", expected e.g. 30s, 5m or 1h30m");
        }
        var total = Duration.ZERO;
        var parts = DURATION_PART.matcher(text);
        try {
            while (parts.find()) {
                var amount = Long.parseLong(parts.group(1));
                total = total.plus(Duration.of(amount, UNITS.get(parts.group(2))));
            }
            // intervals are capped at Long.MAX_VALUE nanoseconds, roughly 292 years
            total.toNanos();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidScheduleException("Duration \"" + text + "\" is too large");
        }
        if (total.isZero() || total.isNegative()) {
            throw new InvalidScheduleException("Duration \"" + text + "\" must be positive");
        }
        return total;
    }

    public static CronFields parseCron(String expression) {
        var trimmed = expression.trim();
        var parts = trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
        if (parts.length != 5) {
            throw new InvalidScheduleException(
                    "Invalid schedule \"" + expression + "\": expected 5 fields, got " + parts.length);
        }
        return new CronFields(
                parseField("minute", parts[0], 0, 59),
                parseField("hour", parts[1], 0, 23),
                parseField("day-of-month", parts[2], 1, 31),
                parseField("month", parts[3], 1, 12),
                parseField("day-of-week", parts[4], 0, 6));
    }

    static SortedSet<Integer> parseField(String name, String field, int min, int max) {
        var values = new TreeSet<Integer>();
        for (var rawItem : field.split(",", -1)) {
            var item = rawItem.trim();

            int step = 1;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                step = parseNumber(name, item.substring(slash + 1), "invalid step in \"" + field + "\"");
                if (step <= 0) {
                    throw new InvalidFieldException(name, "invalid step in \"" + field + "\"");
                }
                item = item.substring(0, slash);
            }

            if (item.equals("*")) {
                for (long i = min; i <= max; i += step) {
                    values.add((int) i);
                }
                continue;
            }

            int dash = item.indexOf('-');
            if (dash >= 0) {
                var message = "invalid range in \"" + field + "\"";
                int lo = parseNumber(name, item.substring(0, dash), message);
                int hi = parseNumber(name, item.substring(dash + 1), message);
                if (lo < min || hi > max || lo > hi) {
                    throw new InvalidFieldException(name,
                            "range " + lo + "-" + hi + " out of bounds [" + min + "," + max + "]");
                }
                for (long i = lo; i <= hi; i += step) {
                    values.add((int) i);
                }
                continue;
            }

            int value = parseNumber(name, item, "invalid value \"" + item + "\"");
            if (value < min || value > max) {
                throw new InvalidFieldException(name,
                        "value " + value + " out of bounds [" + min + "," + max + "]");
            }
            values.add(value);
        }

        if (values.isEmpty()) {
            throw new EmptyFieldException(name);
        }
        return Collections.unmodifiableSortedSet(values);
    }

    private static int parseNumber(String name, String text, String message) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidFieldException(name, message);
        }
    }
}
