package io.cronkeeper.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parsed 5-field ({@code minute hour day month weekday}) or 6-field
 * ({@code second minute hour day month weekday}) cron expression.
 *
 * <p>Each field accepts {@code *}, single values, comma lists, ranges {@code a-b} and steps
 * {@code a-b/n} or {@code a/n}, where a star may stand for the whole range. Weekday 0 is Sunday.
 * Tokens that do not parse contribute nothing to their field.</p>
 *
 * <p>Day-of-month and weekday are both required to match. Unlike POSIX cron there is no
 * "either field" rule when both are restricted.</p>
 */
public final class CronExpression {

    private static final Logger log = LoggerFactory.getLogger(CronExpression.class);

    /** Matches are searched no further than this from the reference time. */
    public static final long SEARCH_HORIZON_MS = 2 * 365 * CronTimes.DAY;

    private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String expression;
    private final ZoneId zone;
    private final BitSet seconds;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet days;
    private final BitSet months;
    private final BitSet weekdays;

    private CronExpression(String expression, ZoneId zone, BitSet seconds, BitSet minutes, BitSet hours,
                           BitSet days, BitSet months, BitSet weekdays) {
        this.expression = expression;
        this.zone = zone;
        this.seconds = seconds;
        this.minutes = minutes;
        this.hours = hours;
        this.days = days;
        this.months = months;
        this.weekdays = weekdays;
    }

    /**
     * Parses an expression evaluated in {@code zone}. Empty when the field count is not 5 or 6.
     */
    public static Optional<CronExpression> parse(String expression, ZoneId zone) {
        String[] parts = split(expression);
        if (parts.length == 6) {
            return Optional.of(new CronExpression(expression, zone,
                    parseField(parts[0], 0, 59),
                    parseField(parts[1], 0, 59),
                    parseField(parts[2], 0, 23),
                    parseField(parts[3], 1, 31),
                    parseField(parts[4], 1, 12),
                    parseField(parts[5], 0, 6)));
        }
        if (parts.length == 5) {
            BitSet zeroSecond = new BitSet(60);
            zeroSecond.set(0);
            return Optional.of(new CronExpression(expression, zone,
                    zeroSecond,
                    parseField(parts[0], 0, 59),
                    parseField(parts[1], 0, 23),
                    parseField(parts[2], 1, 31),
                    parseField(parts[3], 1, 12),
                    parseField(parts[4], 0, 6)));
        }
        return Optional.empty();
    }

    /**
     * Number of whitespace-separated fields in {@code expression}.
     */
    public static int fieldCount(String expression) {
        return split(expression).length;
    }

    /**
     * Returns the first matching time strictly after {@code nowMs}, searching at most
     * {@link #SEARCH_HORIZON_MS} ahead.
     */
    public OptionalLong nextAfter(long nowMs) {
        long horizon = nowMs + SEARCH_HORIZON_MS;
        LocalDateTime candidate = LocalDateTime.ofInstant(Instant.ofEpochMilli(nowMs), zone)
                .truncatedTo(ChronoUnit.SECONDS)
                .plusSeconds(1);

        while (toEpochMillis(candidate) < horizon) {
            int second = candidate.getSecond();
            int minute = candidate.getMinute();
            int hour = candidate.getHour();

            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
            } else if (!days.get(candidate.getDayOfMonth()) || !weekdays.get(weekdayOf(candidate))) {
                candidate = candidate.toLocalDate().plusDays(1).atStartOfDay();
            } else if (!hours.get(hour)) {
                int next = hours.nextSetBit(hour + 1);
                candidate = next < 0
                        ? candidate.toLocalDate().plusDays(1).atStartOfDay()
                        : candidate.toLocalDate().atTime(next, 0, 0);
            } else if (!minutes.get(minute)) {
                int next = minutes.nextSetBit(minute + 1);
                candidate = next < 0
                        ? candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1)
                        : candidate.withMinute(next).withSecond(0);
            } else if (!seconds.get(second)) {
                int next = seconds.nextSetBit(second + 1);
                candidate = next < 0
                        ? candidate.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1)
                        : candidate.withSecond(next);
            } else {
                long millis = toEpochMillis(candidate);
                if (millis > nowMs) {
                    return OptionalLong.of(millis);
                }
                // repeated wall-clock time after a DST fall-back
                candidate = candidate.plusSeconds(1);
            }
        }
        return OptionalLong.empty();
    }

    public String expression() {
        return expression;
    }

    private long toEpochMillis(LocalDateTime time) {
        return time.atZone(zone).toInstant().toEpochMilli();
    }

    private static int weekdayOf(LocalDateTime time) {
        DayOfWeek day = time.getDayOfWeek();
        return day.getValue() % 7;
    }

    private static String[] split(String expression) {
        if (expression == null || expression.isBlank()) {
            return new String[0];
        }
        return WHITESPACE.split(expression.trim());
    }

    static BitSet parseField(String field, int min, int max) {
        BitSet values = new BitSet(max + 1);
        for (String part : field.split(",")) {
            String token = part.trim();
            if (token.contains("/")) {
                parseStep(token, min, max, values);
            } else if (token.contains("-")) {
                String[] bounds = token.split("-", 2);
                Integer start = parseNumber(bounds[0]);
                Integer end = parseNumber(bounds[1]);
                if (start == null || end == null) {
                    log.debug("Ignoring malformed cron range '{}'", token);
                    continue;
                }
                addRange(values, start, end, 1, min, max);
            } else if (token.equals("*")) {
                values.set(min, max + 1);
            } else {
                Integer value = parseNumber(token);
                if (value == null || value < min || value > max) {
                    log.debug("Ignoring malformed cron value '{}'", token);
                    continue;
                }
                values.set(value);
            }
        }
        return values;
    }

    private static void parseStep(String token, int min, int max, BitSet values) {
        String[] parts = token.split("/", 2);
        Integer step = parseNumber(parts[1]);
        if (step == null || step <= 0) {
            log.debug("Ignoring cron step with invalid increment '{}'", token);
            return;
        }
        String range = parts[0];
        int start = min;
        int end = max;
        if (!range.equals("*")) {
            if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                Integer a = parseNumber(bounds[0]);
                Integer b = parseNumber(bounds[1]);
                if (a == null || b == null) {
                    log.debug("Ignoring malformed cron step range '{}'", token);
                    return;
                }
                start = a;
                end = b;
            } else {
                Integer a = parseNumber(range);
                if (a == null) {
                    log.debug("Ignoring malformed cron step start '{}'", token);
                    return;
                }
                start = a;
            }
        }
        addRange(values, start, end, step, min, max);
    }

    private static void addRange(BitSet values, int start, int end, int step, int min, int max) {
        int last = Math.min(end, max);
        for (int i = start; i <= last; i += step) {
            if (i >= min) {
                values.set(i);
            }
        }
    }

    private static Integer parseNumber(String text) {
        String trimmed = text.trim();
        return NUMBER.matcher(trimmed).matches() ? Integer.valueOf(trimmed) : null;
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
