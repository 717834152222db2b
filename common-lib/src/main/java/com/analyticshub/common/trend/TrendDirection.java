package com.analyticshub.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Classified direction of a metric series. */
public enum TrendDirection {
    @JsonProperty("increasing") INCREASING,
    @JsonProperty("decreasing") DECREASING,
    @JsonProperty("stable")     STABLE,
    @JsonProperty("volatile")   VOLATILE;

    /** True for the increasing/decreasing pair in either order. */
    public boolean isOppositeOf(TrendDirection other) {
        return (this == INCREASING && other == DECREASING)
            || (this == DECREASING && other == INCREASING);
    }
}
