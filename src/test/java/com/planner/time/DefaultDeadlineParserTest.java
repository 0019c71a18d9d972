package com.planner.time;

import com.planner.exception.DeadlineParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultDeadlineParser.
 */
class DefaultDeadlineParserTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private DefaultDeadlineParser parser;

    @BeforeEach
    void setUp() {
        parser = new DefaultDeadlineParser(Clock.fixed(NOW, ZoneOffset.UTC), ZoneId.of("Europe/Paris"));
    }

    @ParameterizedTest
    @DisplayName("Absolute ISO-8601 forms")
    @CsvSource({
            "2025-06-03T10:15:30Z, 2025-06-03T10:15:30Z",
            "2025-06-03T10:15:30.250Z, 2025-06-03T10:15:30.250Z",
            "2025-06-03T10:15:30+02:00, 2025-06-03T08:15:30Z",
            "2025-06-03T10:15:30+02:00[Europe/Paris], 2025-06-03T08:15:30Z",
            "2025-06-03T10:15, 2025-06-03T08:15:00Z",
            "2025-06-03 10:15, 2025-06-03T08:15:00Z",
            "2025-06-03, 2025-06-02T22:00:00Z"
    })
    void absoluteForms(String text, String expected) {
        assertEquals(Instant.parse(expected), parser.parse(text));
    }

    @ParameterizedTest
    @DisplayName("Relative phrases")
    @CsvSource({
            "now, 0",
            "today, 0",
            "Tomorrow, 1440",
            "yesterday, -1440",
            "in 3 hours, 180",
            "in 1 week, 10080",
            "45 minutes from now, 45",
            "2 days ago, -2880",
            "  in 10 mins  , 10"
    })
    void relativePhrases(String text, long minutesFromNow) {
        assertEquals(NOW.plus(Duration.ofMinutes(minutesFromNow)), parser.parse(text));
    }

    @ParameterizedTest
    @DisplayName("Unparseable text raises DeadlineParseException with the input")
    @ValueSource(strings = {"next blue moon", "in 3 fortnights", "2025-13-01", "31/12/2025", "in many hours"})
    void unparseable(String text) {
        DeadlineParseException e = assertThrows(DeadlineParseException.class, () -> parser.parse(text));
        assertEquals(text, e.getText());
    }

    @Test
    @DisplayName("Blank text is rejected")
    void blankRejected() {
        assertThrows(DeadlineParseException.class, () -> parser.parse("  "));
        assertThrows(DeadlineParseException.class, () -> parser.parse(null));
    }

    @Test
    @DisplayName("Single-argument constructor uses the clock's zone")
    void clockZone() {
        DefaultDeadlineParser utc = new DefaultDeadlineParser(Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(Instant.parse("2025-06-03T10:15:00Z"), utc.parse("2025-06-03T10:15"));
    }
}
