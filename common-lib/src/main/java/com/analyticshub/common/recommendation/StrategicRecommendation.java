package com.analyticshub.common.recommendation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A ranked, human-readable recommendation derived from exactly one correlation.
 * {@code supportingTrends} holds {@code layer:metricType} keys.
 */
public record StrategicRecommendation(
    @JsonProperty("recommendationId")       String recommendationId,
    @JsonProperty("category")               RecommendationCategory category,
    @JsonProperty("priority")               RecommendationPriority priority,
    @JsonProperty("title")                  String title,
    @JsonProperty("description")            String description,
    @JsonProperty("rationale")              String rationale,
    @JsonProperty("supportingCorrelations") List<String> supportingCorrelations,
    @JsonProperty("supportingTrends")       List<String> supportingTrends,
    @JsonProperty("expectedImpact") @JsonInclude(JsonInclude.Include.NON_NULL)
    ExpectedImpact expectedImpact,
    @JsonProperty("confidence")             double confidence,
    @JsonProperty("timeHorizon")            TimeHorizon timeHorizon
) {
    public StrategicRecommendation {
        supportingCorrelations = List.copyOf(supportingCorrelations);
        supportingTrends       = List.copyOf(supportingTrends);
    }
}
