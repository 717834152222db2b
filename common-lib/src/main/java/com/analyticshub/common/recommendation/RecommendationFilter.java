package com.analyticshub.common.recommendation;

import java.util.Collection;
import java.util.List;

/**
 * Caller-side narrowing of a ranked recommendation list.
 *
 * <p>Applied strictly in this order: focus categories, minimum confidence, then
 * truncation to {@code maxRecommendations}. The input ranking is preserved.
 */
public final class RecommendationFilter {

    private RecommendationFilter() {}

    /**
     * @param focusCategories    categories to keep; {@code null} or empty keeps all
     * @param minConfidence      inclusive lower bound on recommendation confidence
     * @param maxRecommendations maximum list length, at least 1
     */
    public static List<StrategicRecommendation> apply(List<StrategicRecommendation> ranked,
                                                      Collection<RecommendationCategory> focusCategories,
                                                      double minConfidence,
                                                      int maxRecommendations) {
        boolean filterCategories = focusCategories != null && !focusCategories.isEmpty();
        return ranked.stream()
            .filter(r -> !filterCategories || focusCategories.contains(r.category()))
            .filter(r -> r.confidence() >= minConfidence)
            .limit(maxRecommendations)
            .toList();
    }

    /** Mean confidence of the given recommendations; 0.0 for an empty list. */
    public static double overallConfidence(List<StrategicRecommendation> recommendations) {
        return recommendations.stream()
            .mapToDouble(StrategicRecommendation::confidence)
            .average()
            .orElse(0.0);
    }
}
