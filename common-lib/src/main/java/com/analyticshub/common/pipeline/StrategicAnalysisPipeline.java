package com.analyticshub.common.pipeline;

import com.analyticshub.common.aggregation.SignalAggregation;
import com.analyticshub.common.aggregation.SignalAggregator;
import com.analyticshub.common.correlation.CorrelationDetector;
import com.analyticshub.common.model.Signal;
import com.analyticshub.common.recommendation.RecommendationFilter;
import com.analyticshub.common.recommendation.RecommendationSynthesizer;
import com.analyticshub.common.recommendation.StrategicRecommendation;
import com.analyticshub.common.trend.TrendAnalysis;
import com.analyticshub.common.trend.TrendAnalyzer;

import java.util.List;
import java.util.Map;

/**
 * Strategic analysis, start to finish:
 * <ol>
 *   <li>bound signals to the requested layers and time window</li>
 *   <li>analyze trends per (layer, metric type)</li>
 *   <li>detect cross-layer correlations</li>
 *   <li>synthesize and rank recommendations</li>
 *   <li>apply focus categories, minimum confidence and the size cap</li>
 * </ol>
 *
 * <p>Pure; {@code processingDuration} is left at 0 for the caller to fill in.
 */
public final class StrategicAnalysisPipeline {

    private StrategicAnalysisPipeline() {}

    public static StrategicRecommendationReport analyze(StrategicAnalysisRequest request,
                                                        Map<String, List<Signal>> signalsByLayer) {
        return recommend(request, analyzeTrends(request, signalsByLayer));
    }

    /** Steps 1 to 3. */
    public static TrendFindings analyzeTrends(StrategicAnalysisRequest request,
                                              Map<String, List<Signal>> signalsByLayer) {
        SignalAggregation aggregation =
            SignalAggregator.aggregate(request.timeWindow(), request.sourceLayers(), signalsByLayer);

        List<TrendAnalysis> trends = TrendAnalyzer.analyzeTrends(aggregation.signalsByLayer());
        return new TrendFindings(aggregation, trends, CorrelationDetector.detectCorrelations(trends));
    }

    /** Steps 4 and 5; {@code correlationsFound} counts correlations before filtering. */
    public static StrategicRecommendationReport recommend(StrategicAnalysisRequest request, TrendFindings findings) {
        List<StrategicRecommendation> ranked =
            RecommendationSynthesizer.synthesizeRecommendations(findings.correlations());

        List<StrategicRecommendation> recommendations = RecommendationFilter.apply(
            ranked, request.focusCategories(), request.minConfidence(), request.maxRecommendations());

        SignalAggregation aggregation = findings.aggregation();
        return new StrategicRecommendationReport(
            recommendations,
            aggregation.totalSignals(),
            findings.trends().size(),
            findings.correlations().size(),
            RecommendationFilter.overallConfidence(recommendations),
            new AnalysisMetadata(request.timeWindow(), aggregation.layersIncluded(), 0L));
    }
}
