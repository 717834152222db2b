package com.analyticshub.common.correlation;

import com.analyticshub.common.trend.TrendAnalysis;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Heuristic relationship between two trends from different layers.
 * The trends are referenced, not owned.
 */
public record CrossDomainCorrelation(
    @JsonProperty("correlationId")          String correlationId,
    @JsonProperty("primaryTrend")           TrendAnalysis primaryTrend,
    @JsonProperty("secondaryTrend")         TrendAnalysis secondaryTrend,
    @JsonProperty("correlationCoefficient") double correlationCoefficient,
    @JsonProperty("strength")               CorrelationStrength strength,
    @JsonProperty("causality")              Causality causality
) {}
