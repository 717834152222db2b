package com.analyticshub.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One timestamped observation emitted by an upstream analytical layer.
 *
 * <p>{@code confidence} is the layer's self-reported certainty in [0.0, 1.0]; nothing in
 * the core derives or adjusts it. {@code metricType} is only required by the trend
 * pipeline and may be {@code null} for consensus-only signals.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Signal(
    @JsonProperty("signalId")                         String signalId,
    @JsonProperty("sourceLayer") @JsonAlias("layer")  String sourceLayer,
    @JsonProperty("timestamp")                        Instant timestamp,
    @JsonProperty("metricType")                       String metricType,
    @JsonProperty("value")                            SignalValue value,
    @JsonProperty("confidence")                       double confidence,
    @JsonProperty("metadata")                         Map<String, Object> metadata
) {
    public static Signal numeric(String signalId, String sourceLayer, Instant timestamp,
                                 String metricType, double value, double confidence) {
        return new Signal(signalId, sourceLayer, timestamp, metricType,
                          SignalValue.numeric(value), confidence, null);
    }

    public static Signal structured(String signalId, String sourceLayer, Instant timestamp,
                                    Map<String, Object> value, double confidence) {
        return new Signal(signalId, sourceLayer, timestamp, null,
                          SignalValue.structured(value), confidence, null);
    }
}
