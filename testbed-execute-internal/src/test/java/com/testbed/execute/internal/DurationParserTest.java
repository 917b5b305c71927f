package com.testbed.execute.internal;

import com.testbed.errors.SpecificationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DurationParserTest {

    @Test
    void parse_units() {
        assertEquals(Duration.ofSeconds(90), DurationParser.parse("90"));
        assertEquals(Duration.ofMinutes(5), DurationParser.parse("5m"));
        assertEquals(Duration.ofMinutes(90), DurationParser.parse("1h 30m"));
        assertEquals(Duration.ofDays(2), DurationParser.parse("2d"));
    }

    @Test
    void parse_multiplier() {
        assertEquals(Duration.ofMinutes(10), DurationParser.parse("5m *2"));
        assertEquals(Duration.ofSeconds(45), DurationParser.parse("30s *1.5"));
    }

    @Test
    void parse_invalid() {
        assertThrows(SpecificationException.class, () -> DurationParser.parse("five minutes"));
        assertThrows(SpecificationException.class, () -> DurationParser.parse(" "));
    }

    @Test
    void parse_tooLargeIsSpecificationError() {
        SpecificationException e = assertThrows(SpecificationException.class,
                () -> DurationParser.parse("99999999999999999999"));
        assertEquals("Invalid test duration '99999999999999999999'.", e.getMessage());
        assertThrows(SpecificationException.class, () -> DurationParser.parse("106751991167301d"));
        assertThrows(SpecificationException.class, () -> DurationParser.parse("9223372036854775807 1s"));
        assertThrows(SpecificationException.class, () -> DurationParser.parse("9223372036854775807 *2"));
    }

    @Test
    void parse_largestDayCountStillFits() {
        assertEquals(Duration.ofDays(106751991167300L), DurationParser.parse("106751991167300d"));
    }
}
