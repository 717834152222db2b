package com.analyticshub.common.consensus;

import com.analyticshub.common.model.SignalValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A signal whose agreement score fell below the configured threshold. */
public record DivergentSignal(
    @JsonProperty("signalId")        String signalId,
    @JsonProperty("divergenceScore") double divergenceScore,
    @JsonProperty("value")           SignalValue value
) {}
