package com.analyticshub.common.stats;

import java.util.Arrays;

/**
 * Plain numeric helpers shared by the consensus engine and the trend analyzer.
 *
 * <p>Variance is the population variance (divisor {@code n}). All methods expect a
 * non-empty array; callers guard the empty case themselves.
 */
public final class DescriptiveStatistics {

    private DescriptiveStatistics() {}

    public static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double median(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 != 0
            ? sorted[mid]
            : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static double variance(double[] values) {
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) sumSq += (v - mean) * (v - mean);
        return sumSq / values.length;
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /** Half-up rounding to three decimal places. */
    public static double round3(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    /** Half-up rounding to two decimal places. */
    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
