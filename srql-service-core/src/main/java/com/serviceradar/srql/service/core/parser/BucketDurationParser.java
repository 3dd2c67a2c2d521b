package com.serviceradar.srql.service.core.parser;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import java.time.Duration;
import java.util.Locale;

/** Parses downsample bucket widths of the form {@code <int><s|m|h|d>}, e.g. "5m". */
public final class BucketDurationParser {

    static final Duration MAX_BUCKET = Duration.ofDays(31);

    private BucketDurationParser() {}

    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidRequestException("bucket duration cannot be empty");
        }

        String lower = input.trim().toLowerCase(Locale.ROOT);
        Duration duration;
        try {
            duration = toDuration(lower, input);
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("bucket duration must not exceed 31 days");
        }

        if (duration.isZero() || duration.isNegative()) {
            throw new InvalidRequestException("bucket duration must be positive");
        }
        if (duration.compareTo(MAX_BUCKET) > 0) {
            throw new InvalidRequestException("bucket duration must not exceed 31 days");
        }
        return duration;
    }

    private static Duration toDuration(String lower, String input) {
        Duration duration;
        if (lower.endsWith("s")) {
            duration = Duration.ofSeconds(amount(lower, input));
        } else if (lower.endsWith("m")) {
            duration = Duration.ofMinutes(amount(lower, input));
        } else if (lower.endsWith("h")) {
            duration = Duration.ofHours(amount(lower, input));
        } else if (lower.endsWith("d")) {
            duration = Duration.ofDays(amount(lower, input));
        } else {
            throw new InvalidRequestException("unsupported bucket duration '" + input + "'");
        }
        return duration;
    }

    private static long amount(String lower, String input) {
        try {
            return Long.parseLong(lower.substring(0, lower.length() - 1));
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("unsupported bucket duration '" + input + "'");
        }
    }
}
