package com.analyticshub.common.pipeline;

import com.analyticshub.common.recommendation.StrategicRecommendation;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of one strategic analysis.
 *
 * <p>{@code correlationsFound} counts correlations before any recommendation filter ran;
 * {@code recommendations} is the filtered, ranked list.
 */
public record StrategicRecommendationReport(
    @JsonProperty("recommendations")      List<StrategicRecommendation> recommendations,
    @JsonProperty("totalSignalsAnalyzed") int totalSignalsAnalyzed,
    @JsonProperty("trendsIdentified")     int trendsIdentified,
    @JsonProperty("correlationsFound")    int correlationsFound,
    @JsonProperty("overallConfidence")    double overallConfidence,
    @JsonProperty("analysisMetadata")     AnalysisMetadata analysisMetadata
) {
    public StrategicRecommendationReport {
        recommendations = List.copyOf(recommendations);
    }

    /** Copy carrying the wall-clock duration measured by the caller. */
    public StrategicRecommendationReport withProcessingDuration(long processingDurationMs) {
        AnalysisMetadata metadata = new AnalysisMetadata(
            analysisMetadata.timeWindow(), analysisMetadata.layersAnalyzed(), processingDurationMs);
        return new StrategicRecommendationReport(recommendations, totalSignalsAnalyzed, trendsIdentified,
                                                 correlationsFound, overallConfidence, metadata);
    }
}
