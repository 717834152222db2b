package com.analyticshub.common.correlation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Coarse causality label. Derived from the same thresholds as {@link CorrelationStrength},
 * so a STRONG correlation is always LIKELY; it is not a statistically validated claim.
 */
public enum Causality {
    @JsonProperty("none")      NONE,
    @JsonProperty("potential") POTENTIAL,
    @JsonProperty("likely")    LIKELY;

    public static Causality fromCoefficient(double coefficient) {
        return switch (CorrelationStrength.fromCoefficient(coefficient)) {
            case WEAK     -> NONE;
            case MODERATE -> POTENTIAL;
            case STRONG   -> LIKELY;
        };
    }
}
