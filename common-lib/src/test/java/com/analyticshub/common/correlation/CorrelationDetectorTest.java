package com.analyticshub.common.correlation;

import com.analyticshub.common.trend.TrendAnalysis;
import com.analyticshub.common.trend.TrendDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link CorrelationDetector}.
 */
class CorrelationDetectorTest {

    private static TrendAnalysis trend(String layer, String metric, TrendDirection direction, double magnitude) {
        return new TrendAnalysis(metric, layer, direction, magnitude, 0.0, 5, 0.8, null);
    }

    @Nested
    @DisplayName("coefficient")
    class CoefficientTests {

        @Test
        @DisplayName("cost-ops increasing 0.8 vs observatory decreasing 0.6 → -0.84, strong, likely")
        void opposingDirections() {
            List<CrossDomainCorrelation> correlations = CorrelationDetector.detectCorrelations(List.of(
                trend("cost-ops", "spend", TrendDirection.INCREASING, 0.8),
                trend("observatory", "throughput", TrendDirection.DECREASING, 0.6)));

            assertEquals(1, correlations.size());
            CrossDomainCorrelation c = correlations.get(0);
            assertEquals(-0.84, c.correlationCoefficient(), 1e-9);
            assertEquals(CorrelationStrength.STRONG, c.strength());
            assertEquals(Causality.LIKELY, c.causality());
            assertEquals("cost-ops", c.primaryTrend().layer());
            assertEquals("observatory", c.secondaryTrend().layer());
        }

        @Test
        @DisplayName("same direction uses the smaller magnitude")
        void sameDirection() {
            double coef = CorrelationDetector.coefficient(
                trend("cost-ops", "spend", TrendDirection.INCREASING, 0.9),
                trend("observatory", "latency", TrendDirection.INCREASING, 0.25));
            assertEquals(0.7, coef, 1e-9);
        }

        @Test
        @DisplayName("two STABLE trends correlate at 0.6 → moderate, potential")
        void stablePair() {
            CrossDomainCorrelation c = CorrelationDetector.correlate(
                trend("governance", "violations", TrendDirection.STABLE, 0.0),
                trend("observatory", "latency", TrendDirection.STABLE, 0.0)).orElseThrow();
            assertEquals(0.6, c.correlationCoefficient(), 1e-9);
            assertEquals(CorrelationStrength.MODERATE, c.strength());
            assertEquals(Causality.POTENTIAL, c.causality());
        }

        @Test
        @DisplayName("stable vs increasing and volatile vs anything else → no correlation")
        void unrelatedDirections() {
            assertTrue(CorrelationDetector.correlate(
                trend("governance", "violations", TrendDirection.STABLE, 0.5),
                trend("observatory", "latency", TrendDirection.INCREASING, 0.5)).isEmpty());
            assertTrue(CorrelationDetector.correlate(
                trend("governance", "violations", TrendDirection.VOLATILE, 0.5),
                trend("observatory", "latency", TrendDirection.DECREASING, 0.5)).isEmpty());
        }
    }

    @Test
    @DisplayName("trends of the same layer are never paired")
    void noSameLayerPairs() {
        List<CrossDomainCorrelation> correlations = CorrelationDetector.detectCorrelations(List.of(
            trend("observatory", "latency", TrendDirection.INCREASING, 0.5),
            trend("observatory", "errors", TrendDirection.INCREASING, 0.5),
            trend("cost-ops", "spend", TrendDirection.INCREASING, 0.5)));

        assertEquals(2, correlations.size());
        correlations.forEach(c ->
            assertNotEquals(c.primaryTrend().layer(), c.secondaryTrend().layer()));
    }

    @Test
    @DisplayName("strength and causality thresholds")
    void thresholds() {
        assertEquals(CorrelationStrength.WEAK, CorrelationStrength.fromCoefficient(0.49));
        assertEquals(CorrelationStrength.MODERATE, CorrelationStrength.fromCoefficient(-0.5));
        assertEquals(CorrelationStrength.STRONG, CorrelationStrength.fromCoefficient(0.7));
        assertEquals(Causality.NONE, Causality.fromCoefficient(0.3));
        assertEquals(Causality.POTENTIAL, Causality.fromCoefficient(0.69));
        assertEquals(Causality.LIKELY, Causality.fromCoefficient(-0.95));
    }

    @Test
    @DisplayName("correlation ids are stable across runs and distinct per pair")
    void deterministicIds() {
        List<TrendAnalysis> trends = List.of(
            trend("cost-ops", "spend", TrendDirection.INCREASING, 0.5),
            trend("observatory", "latency", TrendDirection.INCREASING, 0.5),
            trend("governance", "violations", TrendDirection.INCREASING, 0.5));

        List<CrossDomainCorrelation> first  = CorrelationDetector.detectCorrelations(trends);
        List<CrossDomainCorrelation> second = CorrelationDetector.detectCorrelations(trends);

        assertEquals(first, second);
        assertEquals(3, first.stream().map(CrossDomainCorrelation::correlationId).distinct().count());
    }
}
