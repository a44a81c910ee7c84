package net.spookly.hostpilot.metrics;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Distribution summary of one flush period of timer samples.
 */
final class TimerStats {
    private final long[] sorted;

    private TimerStats(long[] sorted) {
        this.sorted = sorted;
    }

    static TimerStats of(long[] values) {
        long[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return new TimerStats(copy);
    }

    int size() {
        return sorted.length;
    }

    long max() {
        return sorted.length == 0 ? 0L : sorted[sorted.length - 1];
    }

    long min() {
        return sorted.length == 0 ? 0L : sorted[0];
    }

    double mean() {
        if (sorted.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (long value : sorted) {
            sum += value;
        }
        return sum / sorted.length;
    }

    /**
     * Linear interpolation between closest ranks at position {@code p * (n + 1)}.
     */
    double percentile(double p) {
        int size = sorted.length;
        if (size == 0) {
            return 0.0;
        }
        double pos = p * (size + 1);
        if (pos < 1.0) {
            return sorted[0];
        }
        if (pos >= size) {
            return sorted[size - 1];
        }
        double lower = sorted[(int) pos - 1];
        double upper = sorted[(int) pos];
        return lower + (pos - Math.floor(pos)) * (upper - lower);
    }

    /**
     * Stat name suffix to value, in reporting order.
     */
    Map<String, Double> report() {
        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("max", (double) max());
        stats.put("min", (double) min());
        stats.put("avg", mean());
        stats.put("pct75", percentile(0.75));
        stats.put("pct90", percentile(0.90));
        stats.put("pct95", percentile(0.95));
        stats.put("pct99", percentile(0.99));
        stats.put("pct999", percentile(0.999));
        return stats;
    }
}
