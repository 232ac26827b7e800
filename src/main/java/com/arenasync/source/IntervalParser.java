package com.arenasync.source;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses interval strings such as {@code 90s}, {@code 5m}, {@code 1h30m} or {@code 1.5h}.
 */
public final class IntervalParser {
    private static final Pattern FORMAT = Pattern.compile("^([0-9]+(\\.[0-9]+)?(ms|s|m|h))+$");
    private static final Pattern COMPONENT = Pattern.compile("([0-9]+(?:\\.[0-9]+)?)(ms|s|m|h)");

    private IntervalParser() {
    }

    public static Duration parse(String field, String value) throws ConfigurationException {
        if (value == null || !FORMAT.matcher(value.strip()).matches()) {
            throw new ConfigurationException("invalid " + field + " \"" + value + "\": expected a duration like 30s, 5m or 1h");
        }
        BigDecimal nanos = BigDecimal.ZERO;
        Matcher matcher = COMPONENT.matcher(value.strip());
        while (matcher.find()) {
            BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(unitNanos(matcher.group(2)))));
        }
        Duration duration;
        try {
            duration = Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new ConfigurationException("invalid " + field + " \"" + value + "\": interval is too large");
        }
        if (duration.isZero()) {
            throw new ConfigurationException("invalid " + field + " \"" + value + "\": must be greater than zero");
        }
        return duration;
    }

    private static long unitNanos(String unit) {
        switch (unit) {
            case "ms":
                return 1_000_000L;
            case "s":
                return 1_000_000_000L;
            case "m":
                return 60_000_000_000L;
            default:
                return 3_600_000_000_000L;
        }
    }
}
