package com.analyticshub.common.consensus;

import com.analyticshub.common.stats.DescriptiveStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregation functions applied to the numeric signal values.
 *
 * <p>Only {@link #WEIGHTED_MEAN} consults the weights. {@link #MEAN} stays unweighted even
 * under a non-uniform {@link ConfidenceWeighting}; callers that want confidence to move
 * the consensus value must pick {@code weighted_mean}.
 */
public enum AggregationMethod {

    @JsonProperty("mean")
    MEAN {
        @Override
        public double aggregate(double[] values, double[] weights) {
            return DescriptiveStatistics.mean(values);
        }
    },

    @JsonProperty("median")
    MEDIAN {
        @Override
        public double aggregate(double[] values, double[] weights) {
            return DescriptiveStatistics.median(values);
        }
    },

    /** Most frequent value after rounding to two decimals; the first value seen wins ties. */
    @JsonProperty("mode")
    MODE {
        @Override
        public double aggregate(double[] values, double[] weights) {
            Map<Double, Integer> counts = new LinkedHashMap<>();
            for (double v : values) {
                counts.merge(DescriptiveStatistics.round2(v), 1, Integer::sum);
            }
            double mode = DescriptiveStatistics.round2(values[0]);
            int maxCount = 0;
            for (Map.Entry<Double, Integer> e : counts.entrySet()) {
                if (e.getValue() > maxCount) {
                    maxCount = e.getValue();
                    mode = e.getKey();
                }
            }
            return mode;
        }
    },

    /** {@code Σ(value × weight) / Σweight}; unweighted mean when no weights or a zero total. */
    @JsonProperty("weighted_mean")
    WEIGHTED_MEAN {
        @Override
        public double aggregate(double[] values, double[] weights) {
            if (weights == null || weights.length == 0) {
                return MEAN.aggregate(values, weights);
            }
            double totalWeight = 0.0;
            for (double w : weights) totalWeight += w;
            if (totalWeight == 0.0) {
                return MEAN.aggregate(values, weights);
            }
            double weightedSum = 0.0;
            for (int i = 0; i < values.length; i++) {
                weightedSum += values[i] * weights[i];
            }
            return weightedSum / totalWeight;
        }
    };

    /**
     * @param values  non-empty numeric values
     * @param weights per-value weights aligned with {@code values}; may be ignored
     */
    public abstract double aggregate(double[] values, double[] weights);
}
