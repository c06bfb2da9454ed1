package com.repo.scorecard.report;

import org.junit.jupiter.api.Test;

import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class DurationFormatterTest {

    @Test
    void testUnits() {
        assertEquals("30s", DurationFormatter.format(30_000L));
        assertEquals("45m", DurationFormatter.format(45 * 60_000L));
        assertEquals("3h 20m", DurationFormatter.format((3 * 60 + 20) * 60_000L));
        assertEquals("1d 4h", DurationFormatter.format(28 * 3_600_000L));
    }

    @Test
    void testEdgeValues() {
        assertEquals("0s", DurationFormatter.format(0L));
        assertEquals("0s", DurationFormatter.format(-5_000L));
        assertEquals("1h 0m", DurationFormatter.format(3_600_000L));
    }

    @Test
    void testOptional() {
        assertEquals("-", DurationFormatter.format(OptionalDouble.empty()));
        assertEquals("2h 30m", DurationFormatter.format(OptionalDouble.of(9_000_000.7)));
    }
}
