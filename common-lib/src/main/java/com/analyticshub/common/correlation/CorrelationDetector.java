package com.analyticshub.common.correlation;

import com.analyticshub.common.trend.TrendAnalysis;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Pairwise cross-layer correlation over a set of trends.
 *
 * <h3>Coefficient (heuristic, not Pearson)</h3>
 * <pre>
 *   same direction               →  0.6 + min(mag1, mag2) × 0.4
 *   increasing vs decreasing     → −(0.6 + min(mag1, mag2) × 0.4)
 *   anything else                →  0
 * </pre>
 * Pairs from the same layer are never compared. Pairs with {@code |coef| < 0.3} produce
 * no record.
 *
 * <p>Correlation ids are name-based UUIDs of the two trend keys, so repeated runs over
 * the same trends yield identical output.
 */
public final class CorrelationDetector {

    static final double SIGNIFICANCE_THRESHOLD = 0.3;
    static final double MODERATE_THRESHOLD     = 0.5;
    static final double STRONG_THRESHOLD       = 0.7;

    static final double BASE_COEFFICIENT   = 0.6;
    static final double MAGNITUDE_FACTOR   = 0.4;

    private CorrelationDetector() {}

    /** Compares every unordered pair {@code (i, j), i < j}; the earlier trend becomes primary. */
    public static List<CrossDomainCorrelation> detectCorrelations(List<TrendAnalysis> trends) {
        List<CrossDomainCorrelation> correlations = new ArrayList<>();
        for (int i = 0; i < trends.size(); i++) {
            for (int j = i + 1; j < trends.size(); j++) {
                TrendAnalysis primary   = trends.get(i);
                TrendAnalysis secondary = trends.get(j);
                if (primary.layer().equals(secondary.layer())) {
                    continue;
                }
                correlate(primary, secondary).ifPresent(correlations::add);
            }
        }
        return correlations;
    }

    static Optional<CrossDomainCorrelation> correlate(TrendAnalysis primary, TrendAnalysis secondary) {
        double coefficient = coefficient(primary, secondary);
        if (Math.abs(coefficient) < SIGNIFICANCE_THRESHOLD) {
            return Optional.empty();
        }
        return Optional.of(new CrossDomainCorrelation(
            correlationId(primary, secondary),
            primary,
            secondary,
            coefficient,
            CorrelationStrength.fromCoefficient(coefficient),
            Causality.fromCoefficient(coefficient)));
    }

    static double coefficient(TrendAnalysis a, TrendAnalysis b) {
        double base = BASE_COEFFICIENT + Math.min(a.magnitude(), b.magnitude()) * MAGNITUDE_FACTOR;
        if (a.direction() == b.direction()) {
            return base;
        }
        if (a.direction().isOppositeOf(b.direction())) {
            return -base;
        }
        return 0.0;
    }

    static String correlationId(TrendAnalysis primary, TrendAnalysis secondary) {
        String name = "correlation|" + primary.key() + "|" + secondary.key();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
