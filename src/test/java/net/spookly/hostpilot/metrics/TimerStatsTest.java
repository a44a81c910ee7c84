package net.spookly.hostpilot.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class TimerStatsTest {
    @Test
    void interpolatesBetweenClosestRanks() {
        TimerStats stats = TimerStats.of(new long[]{10, 9, 8, 7, 6, 5, 4, 3, 2, 1});

        assertEquals(10, stats.max());
        assertEquals(1, stats.min());
        assertEquals(5.5, stats.mean(), 1e-9);
        assertEquals(8.25, stats.percentile(0.75), 1e-9);
        assertEquals(9.9, stats.percentile(0.90), 1e-9);
        assertEquals(10.0, stats.percentile(0.99), 1e-9);
    }

    @Test
    void singleSampleIsEveryStat() {
        TimerStats stats = TimerStats.of(new long[]{42});

        for (double value : stats.report().values()) {
            assertEquals(42.0, value, 1e-9);
        }
    }

    @Test
    void emptyStatsAreZero() {
        TimerStats stats = TimerStats.of(new long[0]);

        assertEquals(0, stats.size());
        assertEquals(0.0, stats.percentile(0.5));
    }
}
