package com.serviceradar.srql.service.core.time;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unresolved {@code time:} value. Parsing happens with the rest of the query, resolution against a
 * clock happens when the plan is assembled.
 *
 * Supported forms:
 *  - last_7d, last_15m, last_2w
 *  - "14 days", "3 hours"
 *  - today, yesterday
 *  - [2025-01-01T00:00:00Z,2025-01-02T00:00:00Z] (either side may be empty)
 */
public sealed interface TimeFilterSpec
        permits TimeFilterSpec.Relative, TimeFilterSpec.Today, TimeFilterSpec.Yesterday, TimeFilterSpec.Absolute {

    Pattern LAST = Pattern.compile("^last_(\\d+)\\s*([a-z]+)$");
    Pattern SPACED = Pattern.compile("^(\\d+)\\s+([a-z]+)$");

    TimeRange resolve(Clock clock);

    record Relative(Duration lookback) implements TimeFilterSpec {
        @Override
        public TimeRange resolve(Clock clock) {
            Instant end = clock.instant();
            try {
                return new TimeRange(end.minus(lookback), end);
            } catch (DateTimeException | ArithmeticException e) {
                throw new InvalidRequestException("time window is too large");
            }
        }
    }

    record Today() implements TimeFilterSpec {
        @Override
        public TimeRange resolve(Clock clock) {
            Instant now = clock.instant();
            Instant midnight = LocalDate.ofInstant(now, ZoneOffset.UTC).atStartOfDay().toInstant(ZoneOffset.UTC);
            return new TimeRange(midnight, now);
        }
    }

    record Yesterday() implements TimeFilterSpec {
        @Override
        public TimeRange resolve(Clock clock) {
            LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
            return new TimeRange(
                    today.minusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC),
                    today.atStartOfDay().toInstant(ZoneOffset.UTC));
        }
    }

    /** Absolute window; a null start means the epoch, a null end means now. */
    record Absolute(Instant start, Instant end) implements TimeFilterSpec {
        @Override
        public TimeRange resolve(Clock clock) {
            Instant from = start != null ? start : Instant.EPOCH;
            Instant to = end != null ? end : clock.instant();
            if (from.isAfter(to)) {
                throw new InvalidRequestException("time range start must not be after its end");
            }
            return new TimeRange(from, to);
        }
    }

    static TimeFilterSpec parse(String raw) {
        String value = raw == null ? "" : raw.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.equals("today")) return new Today();
        if (lower.equals("yesterday")) return new Yesterday();

        if (lower.startsWith("[") && lower.endsWith("]")) {
            String body = value.substring(1, value.length() - 1);
            int comma = body.indexOf(',');
            if (comma < 0) {
                throw new InvalidRequestException("unsupported time value '" + raw + "'");
            }
            Instant start = parseInstant(body.substring(0, comma));
            Instant end = parseInstant(body.substring(comma + 1));
            if (start == null && end == null) {
                throw new InvalidRequestException("unsupported time value '" + raw + "'");
            }
            return new Absolute(start, end);
        }

        Matcher m = LAST.matcher(lower);
        if (!m.matches()) {
            m = SPACED.matcher(lower);
        }
        if (m.matches()) {
            long amount;
            try {
                amount = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                throw new InvalidRequestException("unsupported time value '" + raw + "'");
            }
            if (amount <= 0) {
                throw new InvalidRequestException("time window must be positive");
            }
            Duration unit = unit(m.group(2), raw);
            try {
                return new Relative(unit.multipliedBy(amount));
            } catch (ArithmeticException e) {
                throw new InvalidRequestException("time window is too large");
            }
        }
        throw new InvalidRequestException("unsupported time value '" + raw + "'");
    }

    private static Duration unit(String unit, String raw) {
        return switch (unit) {
            case "s", "sec", "secs", "second", "seconds" -> Duration.ofSeconds(1);
            case "m", "min", "mins", "minute", "minutes" -> Duration.ofMinutes(1);
            case "h", "hr", "hrs", "hour", "hours" -> Duration.ofHours(1);
            case "d", "day", "days" -> Duration.ofDays(1);
            case "w", "wk", "wks", "week", "weeks" -> Duration.ofDays(7);
            default -> throw new InvalidRequestException("unsupported time value '" + raw + "'");
        };
    }

    private static Instant parseInstant(String raw) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException ignored) {
            // try a bare date next
        }
        try {
            return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("invalid timestamp '" + value + "'");
        }
    }
}
