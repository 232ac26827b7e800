package com.arenasync.source;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalParserTest {

    @Test
    void shouldParseSingleAndCompoundIntervals() throws Exception {
        assertEquals(Duration.ofSeconds(30), IntervalParser.parse("timeout", "30s"));
        assertEquals(Duration.ofMinutes(5), IntervalParser.parse("syncInterval", "5m"));
        assertEquals(Duration.ofMinutes(90), IntervalParser.parse("syncInterval", "1h30m"));
        assertEquals(Duration.ofMillis(250), IntervalParser.parse("timeout", "250ms"));
        assertEquals(Duration.ofMinutes(90), IntervalParser.parse("syncInterval", "1.5h"));
    }

    @Test
    void shouldRejectMalformedIntervalsWithConfigurationError() {
        ConfigurationException malformed = assertThrows(ConfigurationException.class,
                () -> IntervalParser.parse("syncInterval", "every hour"));
        assertEquals("ConfigurationError", malformed.reason());
        assertTrue(malformed.getMessage().contains("syncInterval"));

        assertThrows(ConfigurationException.class, () -> IntervalParser.parse("timeout", "10"));
        assertThrows(ConfigurationException.class, () -> IntervalParser.parse("timeout", "-5s"));
        assertThrows(ConfigurationException.class, () -> IntervalParser.parse("timeout", null));
    }

    @Test
    void shouldRejectZeroInterval() {
        assertThrows(ConfigurationException.class, () -> IntervalParser.parse("syncInterval", "0s"));
    }

    @Test
    void shouldRejectIntervalBeyondDurationRange() {
        ConfigurationException tooLarge = assertThrows(ConfigurationException.class,
                () -> IntervalParser.parse("syncInterval", "99999999h"));

        assertEquals("ConfigurationError", tooLarge.reason());
        assertTrue(tooLarge.getMessage().endsWith("interval is too large"));
    }

    @Test
    void shouldTruncateSubNanosecondFractions() throws Exception {
        assertEquals(Duration.ofNanos(1), IntervalParser.parse("timeout", "0.0000015ms"));
    }
}
