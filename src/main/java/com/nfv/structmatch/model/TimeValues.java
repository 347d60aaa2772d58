package com.nfv.structmatch.model;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

import static java.time.temporal.ChronoField.HOUR_OF_DAY;
import static java.time.temporal.ChronoField.MINUTE_OF_HOUR;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;
import static java.time.temporal.ChronoField.SECOND_OF_MINUTE;

/**
 * Helpers for the TIME kind of canonical values.
 *
 * <p>Times are represented as {@link OffsetDateTime}. Their textual form is RFC 3339
 * with up to nanosecond precision, e.g. {@code 1990-11-23T02:02:02.000000002-03:00}.
 * Truncation and rounding are computed relative to {@link #ZERO}.
 */
public final class TimeValues {

    /**
     * Zero value of the TIME kind: {@code 0001-01-01T00:00:00Z}
     */
    public static final OffsetDateTime ZERO = OffsetDateTime.of(1, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    /**
     * ISO offset date-time with mandatory seconds
     */
    private static final DateTimeFormatter FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendValue(HOUR_OF_DAY, 2)
            .appendLiteral(':')
            .appendValue(MINUTE_OF_HOUR, 2)
            .appendLiteral(':')
            .appendValue(SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendOffsetId()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);
    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private TimeValues() {
    }

    /**
     * Check if a value is one of the supported point-in-time types
     */
    public static boolean isTimeValue(Object value) {
        return value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof Instant;
    }

    /**
     * Convert a supported point-in-time value. Instants are placed at UTC.
     */
    public static OffsetDateTime toOffsetDateTime(Object value) {
        if (value instanceof OffsetDateTime) {
            return (OffsetDateTime) value;
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toOffsetDateTime();
        }
        if (value instanceof Instant) {
            return ((Instant) value).atOffset(ZoneOffset.UTC);
        }
        throw new IllegalArgumentException("Not a time value: " + (value == null ? "null" : value.getClass().getName()));
    }

    public static String format(OffsetDateTime time) {
        return FORMAT.format(time);
    }

    /**
     * Parse an RFC 3339 timestamp
     *
     * @return the parsed time, or null if the text is not a timestamp
     */
    public static OffsetDateTime parse(String text) {
        // cheap rejection before paying for a parse exception
        if (text == null || text.length() < 20 || text.charAt(4) != '-' || text.charAt(10) != 'T') {
            return null;
        }
        try {
            return OffsetDateTime.parse(text, FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isZero(OffsetDateTime time) {
        return time.isEqual(ZERO);
    }

    /**
     * Round a time down to a multiple of unit. Non-positive units return the time unchanged.
     */
    public static OffsetDateTime truncate(OffsetDateTime time, Duration unit) {
        if (!isPositive(unit)) {
            return time;
        }
        return time.minusNanos(remainder(time, unit).longValueExact());
    }

    /**
     * Round a time to the nearest multiple of unit, halfway values round up
     */
    public static OffsetDateTime round(OffsetDateTime time, Duration unit) {
        if (!isPositive(unit)) {
            return time;
        }
        BigInteger unitNanos = toNanos(unit);
        BigInteger remainder = remainder(time, unit);
        OffsetDateTime truncated = time.minusNanos(remainder.longValueExact());
        if (remainder.shiftLeft(1).compareTo(unitNanos) >= 0) {
            return truncated.plus(unit);
        }
        return truncated;
    }

    private static BigInteger remainder(OffsetDateTime time, Duration unit) {
        Duration sinceZero = Duration.between(ZERO, time);
        return toNanos(sinceZero).mod(toNanos(unit));
    }

    private static BigInteger toNanos(Duration duration) {
        return BigInteger.valueOf(duration.getSeconds())
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(duration.getNano()));
    }

    private static boolean isPositive(Duration unit) {
        return unit != null && !unit.isZero() && !unit.isNegative();
    }
}
