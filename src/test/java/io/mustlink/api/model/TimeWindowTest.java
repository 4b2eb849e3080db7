package io.mustlink.api.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;

import io.mustlink.api.clients.InvalidArgumentException;

public class TimeWindowTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-02T12:00:00Z"), ZoneOffset.UTC);

    @Test
    public void testLastDay() {
        TimeWindow window = TimeWindow.lastDay(CLOCK);

        assertEquals(Instant.parse("2024-03-01T12:00:00Z"), window.getStart());
        assertEquals(Instant.parse("2024-03-02T12:00:00Z"), window.getEnd());
        assertEquals(Duration.ofDays(1), window.getDuration());
    }

    @Test
    public void testParseWithDefaults() {
        TimeWindow window = TimeWindow.parse("2024-03-02 00:00:00", null, CLOCK);

        assertEquals(Instant.parse("2024-03-02T00:00:00Z"), window.getStart());
        assertEquals(Instant.parse("2024-03-02T12:00:00Z"), window.getEnd());
        assertEquals("2024-03-02 00:00:00 - 2024-03-02 12:00:00", window.toString());
    }

    @Test
    public void testInvalidWindows() {
        assertThrows(InvalidArgumentException.class,
                () -> new TimeWindow(Instant.parse("2024-03-02T00:00:00Z"), Instant.parse("2024-03-01T00:00:00Z")));
        assertThrows(InvalidArgumentException.class, () -> TimeWindow.parse("yesterday", null, CLOCK));
        assertThrows(InvalidArgumentException.class, () -> new TimeWindow(null, Instant.EPOCH));
    }
}
