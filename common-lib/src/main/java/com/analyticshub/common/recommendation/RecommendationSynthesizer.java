package com.analyticshub.common.recommendation;

import com.analyticshub.common.correlation.CrossDomainCorrelation;
import com.analyticshub.common.model.SourceLayers;
import com.analyticshub.common.trend.TrendAnalysis;
import com.analyticshub.common.trend.TrendDirection;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns cross-layer correlations into ranked {@link StrategicRecommendation}s.
 *
 * <h3>Rules (first match wins)</h3>
 * <ol>
 *   <li><b>Cost/performance misalignment</b>: primary is {@code cost-ops} INCREASING and
 *       secondary is {@code observatory} DECREASING → COST_OPTIMIZATION, SHORT_TERM,
 *       {@code costSavings = primaryMag × 0.3}, {@code performanceGain = secondaryMag × 0.2},
 *       priority from the primary magnitude.</li>
 *   <li><b>Generic</b>: category from the first layer present in either trend
 *       ({@code cost-ops → observatory → governance}, else STRATEGIC_INITIATIVE),
 *       MEDIUM_TERM, priority from the larger magnitude.</li>
 * </ol>
 *
 * <p>Confidence of a recommendation is the mean of its two trend confidences.
 * Output order: priority (CRITICAL first), then confidence descending.
 */
public final class RecommendationSynthesizer {

    static final double COST_SAVINGS_FACTOR     = 0.3;
    static final double PERFORMANCE_GAIN_FACTOR = 0.2;

    static final Comparator<StrategicRecommendation> RANKING =
        Comparator.comparing(StrategicRecommendation::priority)
                  .thenComparing(Comparator.comparingDouble(StrategicRecommendation::confidence).reversed());

    private RecommendationSynthesizer() {}

    public static List<StrategicRecommendation> synthesizeRecommendations(List<CrossDomainCorrelation> correlations) {
        return correlations.stream()
            .map(RecommendationSynthesizer::fromCorrelation)
            .flatMap(Optional::stream)
            .sorted(RANKING)
            .toList();
    }

    static Optional<StrategicRecommendation> fromCorrelation(CrossDomainCorrelation correlation) {
        TrendAnalysis primary   = correlation.primaryTrend();
        TrendAnalysis secondary = correlation.secondaryTrend();
        double confidence = (primary.confidence() + secondary.confidence()) / 2.0;
        List<String> supportingCorrelations = List.of(correlation.correlationId());
        List<String> supportingTrends = List.of(primary.key(), secondary.key());

        if (isCostPerformanceMisalignment(primary, secondary)) {
            return Optional.of(new StrategicRecommendation(
                recommendationId(correlation),
                RecommendationCategory.COST_OPTIMIZATION,
                RecommendationPriority.determine(correlation.strength(), primary.magnitude()),
                "Cost-Performance Misalignment Detected",
                "Rising costs correlate with declining performance, indicating potential "
                    + "inefficiencies in resource utilization.",
                String.format(Locale.ROOT,
                    "Strong %s correlation (%.2f) between cost trends and performance metrics "
                        + "suggests immediate optimization opportunities.",
                    wireName(correlation), correlation.correlationCoefficient()),
                supportingCorrelations,
                supportingTrends,
                new ExpectedImpact(primary.magnitude() * COST_SAVINGS_FACTOR,
                                   secondary.magnitude() * PERFORMANCE_GAIN_FACTOR,
                                   null),
                confidence,
                TimeHorizon.SHORT_TERM));
        }

        double magnitude = Math.max(primary.magnitude(), secondary.magnitude());
        return Optional.of(new StrategicRecommendation(
            recommendationId(correlation),
            categorize(primary, secondary),
            RecommendationPriority.determine(correlation.strength(), magnitude),
            describe(primary) + " correlates with " + describe(secondary),
            String.format(Locale.ROOT, "Detected %s correlation between %s and %s metrics.",
                wireName(correlation), primary.layer(), secondary.layer()),
            String.format(Locale.ROOT, "Correlation coefficient: %.2f", correlation.correlationCoefficient()),
            supportingCorrelations,
            supportingTrends,
            null,
            confidence,
            TimeHorizon.MEDIUM_TERM));
    }

    static boolean isCostPerformanceMisalignment(TrendAnalysis primary, TrendAnalysis secondary) {
        return SourceLayers.COST_OPS.equals(primary.layer())
            && primary.direction() == TrendDirection.INCREASING
            && SourceLayers.OBSERVATORY.equals(secondary.layer())
            && secondary.direction() == TrendDirection.DECREASING;
    }

    static RecommendationCategory categorize(TrendAnalysis a, TrendAnalysis b) {
        if (involves(a, b, SourceLayers.COST_OPS))    return RecommendationCategory.COST_OPTIMIZATION;
        if (involves(a, b, SourceLayers.OBSERVATORY)) return RecommendationCategory.PERFORMANCE_IMPROVEMENT;
        if (involves(a, b, SourceLayers.GOVERNANCE))  return RecommendationCategory.GOVERNANCE_COMPLIANCE;
        return RecommendationCategory.STRATEGIC_INITIATIVE;
    }

    private static boolean involves(TrendAnalysis a, TrendAnalysis b, String layer) {
        return layer.equals(a.layer()) || layer.equals(b.layer());
    }

    private static String describe(TrendAnalysis trend) {
        return trend.direction().name().toLowerCase(Locale.ROOT) + " " + trend.metricType() + " in " + trend.layer();
    }

    private static String wireName(CrossDomainCorrelation correlation) {
        return correlation.strength().name().toLowerCase(Locale.ROOT);
    }

    static String recommendationId(CrossDomainCorrelation correlation) {
        String name = "recommendation|" + correlation.correlationId();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
