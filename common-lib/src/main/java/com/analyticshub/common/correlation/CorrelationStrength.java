package com.analyticshub.common.correlation;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CorrelationStrength {
    @JsonProperty("weak")     WEAK,
    @JsonProperty("moderate") MODERATE,
    @JsonProperty("strong")   STRONG;

    /** {@code |coef| < 0.5 → WEAK}, {@code < 0.7 → MODERATE}, else {@code STRONG}. */
    public static CorrelationStrength fromCoefficient(double coefficient) {
        double abs = Math.abs(coefficient);
        if (abs < CorrelationDetector.MODERATE_THRESHOLD) return WEAK;
        if (abs < CorrelationDetector.STRONG_THRESHOLD)   return MODERATE;
        return STRONG;
    }
}
