package com.analyticshub.common.trend;

/**
 * Ordinary least squares over {@code (index, value)} pairs.
 *
 * <p>The independent variable is the position in the time-ordered series, not the
 * timestamp, so unevenly spaced samples are treated as evenly spaced.
 */
final class LinearRegression {

    private LinearRegression() {}

    /**
     * {@code slope = (nΣxy − ΣxΣy) / (nΣx² − (Σx)²)}.
     *
     * @param values at least two time-ordered values
     */
    static double slope(double[] values) {
        int n = values.length;
        double sumX = 0.0, sumY = 0.0, sumXY = 0.0, sumX2 = 0.0;
        for (int i = 0; i < n; i++) {
            sumX  += i;
            sumY  += values[i];
            sumXY += i * values[i];
            sumX2 += (double) i * i;
        }
        return (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    }
}
