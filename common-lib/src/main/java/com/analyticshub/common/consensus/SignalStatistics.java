package com.analyticshub.common.consensus;

import com.analyticshub.common.stats.DescriptiveStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Unweighted summary statistics over the numeric signal values. */
public record SignalStatistics(
    @JsonProperty("mean")     double mean,
    @JsonProperty("median")   double median,
    @JsonProperty("stdDev")   double stdDev,
    @JsonProperty("variance") double variance
) {
    public static SignalStatistics of(double[] values) {
        double variance = DescriptiveStatistics.variance(values);
        return new SignalStatistics(
            DescriptiveStatistics.mean(values),
            DescriptiveStatistics.median(values),
            Math.sqrt(variance),
            variance);
    }
}
