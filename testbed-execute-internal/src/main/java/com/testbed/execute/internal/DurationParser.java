package com.testbed.execute.internal;

import com.testbed.errors.SpecificationException;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses test {@code duration} values: whitespace separated parts like {@code 90}, {@code 5m},
 * {@code 1h 30m}, {@code 2d}, summed, with optional {@code *N} multipliers applied at the end.
 */
public final class DurationParser {

    private static final Pattern PART = Pattern.compile("(\\d+)([smhd]?)");
    private static final Pattern MULTIPLIER = Pattern.compile("\\*(\\d+(?:\\.\\d+)?)");

    private DurationParser() {
    }

    /**
     * @throws SpecificationException if the value is empty, malformed or too large
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new SpecificationException("Empty test duration.");
        }
        long seconds = 0;
        double factor = 1.0;
        try {
            for (String token : value.trim().toLowerCase(Locale.ROOT).split("\\s+")) {
                Matcher part = PART.matcher(token);
                Matcher multiplier = MULTIPLIER.matcher(token);
                if (part.matches()) {
                    seconds = Math.addExact(seconds, Math.multiplyExact(Long.parseLong(part.group(1)), unit(part.group(2))));
                } else if (multiplier.matches()) {
                    factor *= Double.parseDouble(multiplier.group(1));
                } else {
                    throw invalid(value);
                }
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw invalid(value);
        }
        if (factor == 1.0) {
            return Duration.ofSeconds(seconds);
        }
        double scaled = seconds * factor;
        // Math.round saturates instead of failing.
        if (!Double.isFinite(scaled) || scaled >= Long.MAX_VALUE) {
            throw invalid(value);
        }
        return Duration.ofSeconds(Math.round(scaled));
    }

    private static long unit(String suffix) {
        return switch (suffix) {
            case "m" -> 60;
            case "h" -> 3600;
            case "d" -> 86400;
            default -> 1;
        };
    }

    private static SpecificationException invalid(String value) {
        return new SpecificationException("Invalid test duration '" + value + "'.");
    }
}
