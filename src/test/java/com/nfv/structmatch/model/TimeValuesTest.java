package com.nfv.structmatch.model;

import org.junit.jupiter.api.*;

import java.time.*;

import static org.junit.jupiter.api.Assertions.*;

class TimeValuesTest {

    private static final OffsetDateTime T1 = OffsetDateTime.of(1990, 11, 23, 2, 2, 2, 2, ZoneOffset.ofHours(-3));

    @Test
    @DisplayName("Times are formatted as RFC 3339 with nanoseconds")
    void testFormat() {
        assertEquals("1990-11-23T02:02:02.000000002-03:00", TimeValues.format(T1));
        assertEquals("1990-11-23T05:02:02.000000002Z", TimeValues.format(T1.withOffsetSameInstant(ZoneOffset.UTC)));
    }

    @Test
    @DisplayName("Parse accepts RFC 3339 and rejects other strings")
    void testParse() {
        assertEquals(T1, TimeValues.parse("1990-11-23T02:02:02.000000002-03:00"));
        assertEquals(OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC),
                TimeValues.parse("2024-03-01T10:00:00Z"));

        assertNull(TimeValues.parse(null));
        assertNull(TimeValues.parse("red"));
        assertNull(TimeValues.parse("2024-03-01"), "A date without time is not a timestamp");
        assertNull(TimeValues.parse("2024-03-01T10:00:00"), "A timestamp without offset is rejected");
        assertNull(TimeValues.parse("2024-13-01T10:00:00Z"));
        assertNull(TimeValues.parse("2024-03-01T10:00Z"), "Seconds are required");
        assertNull(TimeValues.parse("2024-03-01T10:00+02:00"), "Seconds are required");
        assertEquals(OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC),
                TimeValues.parse("2024-03-01t10:00:00z"), "Letters are case-insensitive");
    }

    @Test
    @DisplayName("Instants and zoned times convert to offset times")
    void testConversion() {
        Instant instant = Instant.parse("2024-03-01T10:00:00Z");
        assertEquals(OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC), TimeValues.toOffsetDateTime(instant));

        ZonedDateTime zoned = T1.atZoneSameInstant(ZoneId.of("Europe/Paris"));
        assertTrue(T1.isEqual(TimeValues.toOffsetDateTime(zoned)));

        assertTrue(TimeValues.isTimeValue(instant));
        assertFalse(TimeValues.isTimeValue("2024-03-01T10:00:00Z"));
        assertThrows(IllegalArgumentException.class, () -> TimeValues.toOffsetDateTime("red"));
    }

    @Test
    @DisplayName("Zero time is the first instant of year 1 in UTC")
    void testZero() {
        assertTrue(TimeValues.isZero(TimeValues.ZERO));
        assertTrue(TimeValues.isZero(OffsetDateTime.of(1, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(1))),
                "Same instant in another offset is still zero");
        assertFalse(TimeValues.isZero(T1));
    }

    @Test
    @DisplayName("Truncate rounds down to a multiple of the unit")
    void testTruncate() {
        OffsetDateTime time = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 900_000_000, ZoneOffset.UTC);
        assertEquals(OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC),
                TimeValues.truncate(time, Duration.ofSeconds(1)));

        OffsetDateTime local = OffsetDateTime.of(2024, 3, 1, 2, 30, 0, 0, ZoneOffset.ofHours(-3));
        assertEquals(OffsetDateTime.of(2024, 3, 1, 2, 0, 0, 0, ZoneOffset.ofHours(-3)),
                TimeValues.truncate(local, Duration.ofHours(1)), "Offset is kept");

        assertEquals(time, TimeValues.truncate(time, Duration.ZERO));
        assertEquals(time, TimeValues.truncate(time, null));
    }

    @Test
    @DisplayName("Round goes to the nearest multiple, halfway values round up")
    void testRound() {
        OffsetDateTime base = OffsetDateTime.of(2024, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);
        Duration second = Duration.ofSeconds(1);

        assertEquals(base, TimeValues.round(base.plusNanos(499_999_999), second));
        assertEquals(base.plusSeconds(1), TimeValues.round(base.plusNanos(500_000_000), second));
        assertEquals(base.plusSeconds(1), TimeValues.round(base.plusNanos(900_000_000), second));
        assertEquals(base, TimeValues.round(base, second));
    }
}
