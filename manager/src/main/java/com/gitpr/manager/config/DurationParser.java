package com.gitpr.manager.config;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human duration strings such as {@code 30d}, {@code 12h}, {@code 1h30m},
 * {@code 500ms} or {@code 2w}. A bare number is read as seconds.
 */
public final class DurationParser {

    static final Pattern SEGMENT = Pattern.compile("(\\d+)(ms|s|m|h|d|w)");
    private static final Pattern BARE_NUMBER = Pattern.compile("\\d+");

    private DurationParser() {
    }

    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("duration must not be empty");
        }
        String text = value.trim().toLowerCase();
        try {
            if (BARE_NUMBER.matcher(text).matches()) {
                return Duration.ofSeconds(Long.parseLong(text));
            }

            Matcher matcher = SEGMENT.matcher(text);
            Duration total = Duration.ZERO;
            int position = 0;
            while (matcher.find()) {
                if (matcher.start() != position) {
                    break;
                }
                total = total.plus(segment(Long.parseLong(matcher.group(1)), matcher.group(2)));
                position = matcher.end();
            }
            if (position == 0 || position != text.length()) {
                throw new IllegalArgumentException("invalid duration: '" + value + "'");
            }
            return total;
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("invalid duration: '" + value + "' is out of range", e);
        }
    }

    /**
     * Parses {@code value}, returning {@code fallback} when the value is blank.
     */
    public static Duration parseOrDefault(String value, Duration fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return parse(value);
    }

    /**
     * Formats a duration using the largest whole units, e.g. {@code 30d} or {@code 1h30m}.
     */
    public static String format(Duration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        long days = duration.toDays();
        if (days > 0) {
            sb.append(days).append('d');
        }
        if (duration.toHoursPart() > 0) {
            sb.append(duration.toHoursPart()).append('h');
        }
        if (duration.toMinutesPart() > 0) {
            sb.append(duration.toMinutesPart()).append('m');
        }
        if (duration.toSecondsPart() > 0) {
            sb.append(duration.toSecondsPart()).append('s');
        }
        if (duration.toMillisPart() > 0) {
            sb.append(duration.toMillisPart()).append("ms");
        }
        return sb.toString();
    }

    private static Duration segment(long amount, String unit) {
        return switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7L));
            default -> throw new IllegalArgumentException("unknown duration unit: " + unit);
        };
    }
}
