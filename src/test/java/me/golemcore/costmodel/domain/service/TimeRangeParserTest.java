package me.golemcore.costmodel.domain.service;

import me.golemcore.costmodel.domain.exception.InvalidRangeException;
import me.golemcore.costmodel.domain.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimeRangeParserTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private final TimeRangeParser parser = new TimeRangeParser(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void parsesSingleAndCompoundDurations() {
        assertEquals(Duration.ofHours(24), parser.parseDuration("24h"));
        assertEquals(Duration.ofDays(7), parser.parseDuration("7d"));
        assertEquals(Duration.ofDays(14), parser.parseDuration("2w"));
        assertEquals(Duration.ofMinutes(90), parser.parseDuration("1h30m"));
        assertEquals(Duration.ofMillis(1500), parser.parseDuration("1s500ms"));
        assertEquals(Duration.ZERO, parser.parseDuration("0"));
    }

    @Test
    void rejectsInvalidDurations() {
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration(""));
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration(null));
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration("24"));
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration("1m1h"));
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration("-5m"));
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration("abc"));
    }

    @Test
    void resolvesWindowEndingNow() {
        TimeWindow window = parser.resolveWindow("24h", "");

        assertEquals(NOW, window.end());
        assertEquals(Instant.parse("2024-06-14T12:00:00Z"), window.start());
        assertEquals(Duration.ofHours(24), window.duration());
        assertEquals(1440.0, window.minutes());
    }

    @Test
    void offsetShiftsWindowIntoThePast() {
        TimeWindow plain = parser.resolveWindow("1d", "3h");
        TimeWindow keyword = parser.resolveWindow("1d", "offset 3h");

        assertEquals(Instant.parse("2024-06-15T09:00:00Z"), plain.end());
        assertEquals(Instant.parse("2024-06-14T09:00:00Z"), plain.start());
        assertEquals(plain, keyword);
    }

    @Test
    void zeroLengthWindowIsRejected() {
        assertThrows(InvalidRangeException.class, () -> parser.resolveWindow("0", ""));
        assertThrows(InvalidRangeException.class, () -> parser.resolveWindow("0h", ""));
    }

    @Test
    void overflowingDurationsAreRejected() {
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration("2635249153387078803w"));
        assertThrows(InvalidRangeException.class, () -> parser.parseDuration("99999999999999999999d"));
        assertThrows(InvalidRangeException.class, () -> parser.resolveWindow("2635249153387078802w", ""));
    }

    @Test
    void windowsReachingPastTheEarliestInstantAreRejected() {
        assertThrows(InvalidRangeException.class, () -> parser.resolveWindow("100000000000w", ""));
        assertThrows(InvalidRangeException.class, () -> parser.resolveWindow("1h", "100000000000w"));
    }

    @Test
    void invalidOffsetIsRejected() {
        assertThrows(InvalidRangeException.class, () -> parser.resolveWindow("24h", "yesterday"));
        assertEquals(Duration.ZERO, parser.parseOffset(null));
        assertEquals(Duration.ZERO, parser.parseOffset("  "));
    }

    @Test
    void invalidRangeIsAnIllegalArgument() {
        assertInstanceOf(IllegalArgumentException.class,
                assertThrows(InvalidRangeException.class, () -> parser.parseDuration("x")));
    }

    @Test
    void parsesIsoTimestamps() {
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), parser.parseTimestamp("2024-01-01T00:00:00.000Z"));
        assertThrows(InvalidRangeException.class, () -> parser.parseTimestamp("01/01/2024"));
        assertThrows(InvalidRangeException.class, () -> parser.parseTimestamp(""));
    }
}
