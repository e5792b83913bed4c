package io.relay4j.utils;

import io.relay4j.TriggerRule;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@link TriggerRule}s from schedule specs.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Cron expressions, 5 fields ("*&#47;5 * * * *") or 6 fields with seconds ("0 0 2 * * *")</li>
 *   <li>Fixed time of day: "AT 09:00"</li>
 *   <li>Numeric seconds: "30"</li>
 *   <li>Human-readable intervals: "5 minutes", "1 day 3 hours", "10m"</li>
 * </ul>
 */
public final class Triggers {
    private static final String UNITS = "weeks?|w|days?|d|hours?|h|minutes?|min|m|seconds?|sec|s";
    private static final Pattern INTERVAL_PART = Pattern.compile("(\\d+)\\s*(" + UNITS + ")");
    private static final Pattern INTERVAL = Pattern.compile("(?:\\d+\\s*(?:" + UNITS + ")\\s*)+");

    private Triggers() {
    }

    /**
     * Parse a schedule spec.
     *
     * @param spec     schedule spec
     * @param timezone IANA zone id used by cron and "AT" specs; UTC when null
     */
    public static TriggerRule parse(String spec, String timezone) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        ZoneId zone = zone(timezone);

        if (s.regionMatches(true, 0, "AT ", 0, 3)) {
            String timeOfDay = s.substring(3).trim();
            try {
                return dailyAt(LocalTime.parse(timeOfDay), zone);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid time of day: " + timeOfDay, e);
            }
        }

        if (isCronShaped(s)) {
            return cron(s, zone);
        }

        return every(parseHumanDuration(s));
    }

    public static TriggerRule parse(String spec) {
        return parse(spec, null);
    }

    /**
     * Fixed interval; each fire time is the previous one plus {@code interval}.
     */
    public static TriggerRule every(Duration interval) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        return new TriggerRule() {
            @Override
            public Instant nextFireAfter(Instant previous) {
                return previous.plus(interval);
            }

            @Override
            public String toString() {
                return "every " + interval;
            }
        };
    }

    public static TriggerRule cron(String expression, ZoneId zone) {
        Objects.requireNonNull(zone, "zone must not be null");
        String normalized = normalizeCron(expression);
        CronExpression exp;
        try {
            exp = new CronExpression(normalized);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + expression, e);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        return new TriggerRule() {
            @Override
            public Instant nextFireAfter(Instant previous) {
                // CronExpression is not thread-safe
                synchronized (exp) {
                    Date next = exp.getNextValidTimeAfter(Date.from(previous));
                    return next == null ? null : next.toInstant();
                }
            }

            @Override
            public String toString() {
                return "cron " + normalized + " " + zone;
            }
        };
    }

    public static TriggerRule dailyAt(LocalTime timeOfDay, ZoneId zone) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        return new TriggerRule() {
            @Override
            public Instant nextFireAfter(Instant previous) {
                ZonedDateTime base = ZonedDateTime.ofInstant(previous, zone);
                ZonedDateTime candidate = base.with(timeOfDay);
                if (!candidate.isAfter(base)) {
                    candidate = candidate.plusDays(1).with(timeOfDay);
                }
                return candidate.toInstant();
            }

            @Override
            public String toString() {
                return "at " + timeOfDay + " " + zone;
            }
        };
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - 5-field cron gets a leading "0" seconds field.
     * - One of day-of-month / day-of-week becomes "?".
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dow) && !"?".equals(dom)) {
            dow = "?";
        } else if ("*".equals(dom) && !"?".equals(dow)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            String s = spec.trim();
            int fields = s.split("\\s+").length;
            return (fields == 5 || fields == 6) && CronExpression.isValidExpression(normalizeCron(s));
        } catch (RuntimeException ignored) {
            return false;
        }
    }

    // five or six fields that are not "<n> <unit>" pairs; invalid cron fails as cron, not as an interval
    private static boolean isCronShaped(String s) {
        int fields = s.split("\\s+").length;
        return (fields == 5 || fields == 6) && !INTERVAL.matcher(s.toLowerCase(Locale.ROOT)).matches();
    }

    /**
     * Parse "30", "30s", "5 minutes" or "1 hour 30 minutes".
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }
        if (!s.matches("\\d+") && !INTERVAL.matcher(s).matches()) {
            throw new IllegalArgumentException(
                    "Invalid interval, expected e.g. \"30\", \"30s\" or \"1 hour 30 minutes\": " + input);
        }

        try {
            if (s.matches("\\d+")) {
                return requirePositive(Duration.ofSeconds(Long.parseLong(s)), input);
            }
            Duration total = Duration.ZERO;
            Matcher m = INTERVAL_PART.matcher(s);
            while (m.find()) {
                total = total.plus(unit(m.group(2)).multipliedBy(Long.parseLong(m.group(1))));
            }
            return requirePositive(total, input);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Interval out of range: " + input, e);
        }
    }

    private static Duration unit(String name) {
        return switch (name.charAt(0)) {
            case 'w' -> ChronoUnit.WEEKS.getDuration();
            case 'd' -> ChronoUnit.DAYS.getDuration();
            case 'h' -> ChronoUnit.HOURS.getDuration();
            case 'm' -> ChronoUnit.MINUTES.getDuration();
            default -> ChronoUnit.SECONDS.getDuration();
        };
    }

    private static Duration requirePositive(Duration d, String input) {
        if (d.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return d;
    }

    private static ZoneId zone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
        }
    }
}
