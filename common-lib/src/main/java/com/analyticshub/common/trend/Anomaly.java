package com.analyticshub.common.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** A point lying more than two standard deviations from its series mean. */
public record Anomaly(
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("value")          double value,
    @JsonProperty("deviationScore") double deviationScore
) {}
