package com.analyticshub.analytics.dto;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.TimeWindow;
import com.analyticshub.common.pipeline.StrategicAnalysisRequest;
import com.analyticshub.common.recommendation.RecommendationCategory;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Strategic analysis request as received.
 *
 * <p>{@code signalsByLayer} is optional; without it signals are read from the signal store.
 */
public record StrategicRecommendationRequest(
    @JsonProperty("timeWindow")         TimeWindow timeWindow,
    @JsonProperty("sourceLayers")       List<String> sourceLayers,
    @JsonProperty("minConfidence")      Double minConfidence,
    @JsonProperty("maxRecommendations") Integer maxRecommendations,
    @JsonProperty("focusCategories")    List<RecommendationCategory> focusCategories,
    @JsonProperty("signalsByLayer")     Map<String, List<Signal>> signalsByLayer,
    @JsonProperty("executionRef")       String executionRef
) {
    public boolean hasInlineSignals() {
        return signalsByLayer != null;
    }

    public StrategicAnalysisRequest toAnalysisRequest() {
        return new StrategicAnalysisRequest(
            timeWindow,
            sourceLayers,
            minConfidence != null ? minConfidence : StrategicAnalysisRequest.DEFAULT_MIN_CONFIDENCE,
            maxRecommendations != null ? maxRecommendations : StrategicAnalysisRequest.DEFAULT_MAX_RECOMMENDATIONS,
            focusCategories);
    }
}
