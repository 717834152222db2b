package com.analyticshub.common.pipeline;

import com.analyticshub.common.model.SourceLayers;
import com.analyticshub.common.model.TimeWindow;
import com.analyticshub.common.recommendation.RecommendationCategory;

import java.util.List;

/**
 * Parameters of one strategic analysis. Null collections fall back to the defaults:
 * every known layer, no category focus.
 */
public record StrategicAnalysisRequest(
    TimeWindow timeWindow,
    List<String> sourceLayers,
    double minConfidence,
    int maxRecommendations,
    List<RecommendationCategory> focusCategories
) {
    public static final double DEFAULT_MIN_CONFIDENCE     = 0.5;
    public static final int    DEFAULT_MAX_RECOMMENDATIONS = 10;

    public StrategicAnalysisRequest {
        sourceLayers = sourceLayers == null || sourceLayers.isEmpty()
            ? SourceLayers.DEFAULT_LAYERS : List.copyOf(sourceLayers);
        focusCategories = focusCategories == null ? List.of() : List.copyOf(focusCategories);
    }

    public static StrategicAnalysisRequest withDefaults(TimeWindow timeWindow) {
        return new StrategicAnalysisRequest(timeWindow, null, DEFAULT_MIN_CONFIDENCE,
                                            DEFAULT_MAX_RECOMMENDATIONS, null);
    }
}
