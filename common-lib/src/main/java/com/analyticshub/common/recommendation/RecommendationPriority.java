package com.analyticshub.common.recommendation;

import com.analyticshub.common.correlation.CorrelationStrength;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Urgency of a recommendation. Declaration order is the sort order: CRITICAL first.
 */
public enum RecommendationPriority {
    @JsonProperty("critical") CRITICAL,
    @JsonProperty("high")     HIGH,
    @JsonProperty("medium")   MEDIUM,
    @JsonProperty("low")      LOW;

    static final double CRITICAL_MAGNITUDE = 0.7;
    static final double HIGH_MAGNITUDE     = 0.6;

    /**
     * <pre>
     *   STRONG and magnitude > 0.7                 → CRITICAL
     *   STRONG, or MODERATE and magnitude > 0.6    → HIGH
     *   MODERATE                                   → MEDIUM
     *   otherwise                                  → LOW
     * </pre>
     */
    public static RecommendationPriority determine(CorrelationStrength strength, double magnitude) {
        if (strength == CorrelationStrength.STRONG && magnitude > CRITICAL_MAGNITUDE) {
            return CRITICAL;
        }
        if (strength == CorrelationStrength.STRONG
            || (strength == CorrelationStrength.MODERATE && magnitude > HIGH_MAGNITUDE)) {
            return HIGH;
        }
        if (strength == CorrelationStrength.MODERATE) {
            return MEDIUM;
        }
        return LOW;
    }
}
