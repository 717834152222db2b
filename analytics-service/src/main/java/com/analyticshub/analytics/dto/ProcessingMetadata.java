package com.analyticshub.analytics.dto;

import com.analyticshub.common.consensus.AggregationMethod;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ProcessingMetadata(
    @JsonProperty("signalsProcessed")  int signalsProcessed,
    @JsonProperty("computationTimeMs") long computationTimeMs,
    @JsonProperty("method")            AggregationMethod method
) {}
