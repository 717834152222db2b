package com.analyticshub.common.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.function.DoubleUnaryOperator;

/**
 * Maps a signal's confidence to its aggregation weight.
 *
 * <pre>
 *   UNIFORM      → 1.0
 *   PROPORTIONAL → confidence
 *   EXPONENTIAL  → confidence²
 * </pre>
 */
public enum ConfidenceWeighting {

    @JsonProperty("uniform")      UNIFORM(confidence -> 1.0),
    @JsonProperty("proportional") PROPORTIONAL(confidence -> confidence),
    @JsonProperty("exponential")  EXPONENTIAL(confidence -> Math.pow(confidence, 2));

    private final DoubleUnaryOperator weightFn;

    ConfidenceWeighting(DoubleUnaryOperator weightFn) {
        this.weightFn = weightFn;
    }

    public double weight(double confidence) {
        return weightFn.applyAsDouble(confidence);
    }
}
