package com.analyticshub.common.trend;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Trend of one metric within one layer.
 *
 * <p>{@code anomalies} is never {@code null}; it is left out of the JSON when empty.
 */
public record TrendAnalysis(
    @JsonProperty("metricType") String metricType,
    @JsonProperty("layer")      String layer,
    @JsonProperty("direction")  TrendDirection direction,
    @JsonProperty("magnitude")  double magnitude,
    @JsonProperty("velocity")   double velocity,
    @JsonProperty("dataPoints") int dataPoints,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("anomalies") @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<Anomaly> anomalies
) {
    public TrendAnalysis {
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    /** {@code layer:metricType}, the form used to reference a trend from a recommendation. */
    public String key() {
        return layer + ":" + metricType;
    }
}
