package com.planner.estimate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for NaturalLanguageParser.
 */
class NaturalLanguageParserTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private NaturalLanguageParser parser;

    @BeforeEach
    void setUp() {
        parser = new NaturalLanguageParser(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Short text is used as title unchanged")
    void shortTitleUnchanged() {
        String text = "a".repeat(60);
        ParsedTask parsed = parser.parse(text);

        assertEquals(text, parsed.title());
        assertEquals(text, parsed.description());
    }

    @Test
    @DisplayName("Long text is truncated to 57 characters plus ellipsis")
    void longTitleTruncated() {
        String text = "b".repeat(61);
        ParsedTask parsed = parser.parse(text);

        assertEquals("b".repeat(57) + "...", parsed.title());
        assertEquals(60, parsed.title().length());
        assertEquals(text, parsed.description());
    }

    @Test
    @DisplayName("'tomorrow' infers now + 1 day")
    void tomorrow() {
        ParsedTask parsed = parser.parse("Send invoice Tomorrow");

        assertEquals(NOW.plus(Duration.ofDays(1)), parsed.deadline());
    }

    @Test
    @DisplayName("'today' infers now")
    void today() {
        assertEquals(NOW, parser.parse("finish today").deadline());
    }

    @Test
    @DisplayName("'tomorrow' wins when both words appear")
    void tomorrowWinsOverToday() {
        ParsedTask parsed = parser.parse("not today, tomorrow");

        assertEquals(NOW.plus(Duration.ofDays(1)), parsed.deadline());
    }

    @Test
    @DisplayName("No date words means no deadline")
    void noDeadline() {
        assertNull(parser.parse("Plan the offsite").deadline());
    }

    @Test
    @DisplayName("Urgency hint follows the urgent keyword tier only")
    void urgencyHint() {
        assertTrue(parser.parse("Reply ASAP").urgent());
        assertFalse(parser.parse("Important but not pressing").urgent());
    }

    @Test
    @DisplayName("Null text parses as empty")
    void nullText() {
        ParsedTask parsed = parser.parse(null);

        assertEquals("", parsed.title());
        assertNull(parsed.deadline());
        assertFalse(parsed.urgent());
    }
}
