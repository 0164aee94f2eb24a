package ch.so.agi.gretllog.config;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses the {@code scan.period} value of a configuration file, e.g.
 * {@code "30 seconds"} or {@code "500 ms"}.
 * <p>
 * Supported units: {@code millisecond(s)/ms}, {@code second(s)/s},
 * {@code minute(s)/m}, {@code hour(s)/h} and {@code day(s)/d}. A value that
 * does not consist of exactly a finite decimal number and a unit resolves to
 * {@link #DEFAULT_MILLIS}. Every resolved period is at least
 * {@link #MIN_MILLIS}.
 */
public final class ScanPeriod {

    public static final long DEFAULT_MILLIS = 60_000L;
    public static final long MIN_MILLIS = 1_000L;

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private ScanPeriod() {}

    /**
     * @param value textual period, may be {@code null}
     * @return period in milliseconds, never below {@link #MIN_MILLIS}
     */
    public static long parseMillis(String value) {
        if (value == null) {
            return DEFAULT_MILLIS;
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length != 2) {
            return DEFAULT_MILLIS;
        }

        // plain decimals only, no Infinity, hex or d/f suffixes
        if (!NUMBER.matcher(parts[0]).matches()) {
            return DEFAULT_MILLIS;
        }
        double number = Double.parseDouble(parts[0]);
        if (!Double.isFinite(number)) {
            return DEFAULT_MILLIS;
        }

        long millis;
        switch (parts[1].toLowerCase(Locale.ROOT)) {
            case "millisecond":
            case "milliseconds":
            case "ms":
                millis = (long) number;
                break;
            case "second":
            case "seconds":
            case "s":
                millis = (long) (number * 1000);
                break;
            case "minute":
            case "minutes":
            case "m":
                millis = (long) (number * 60 * 1000);
                break;
            case "hour":
            case "hours":
            case "h":
                millis = (long) (number * 60 * 60 * 1000);
                break;
            case "day":
            case "days":
            case "d":
                millis = (long) (number * 24 * 60 * 60 * 1000);
                break;
            default:
                millis = DEFAULT_MILLIS;
        }
        return Math.max(millis, MIN_MILLIS);
    }
}
