package com.analyticshub.common.trend;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.stats.DescriptiveStatistics;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives one {@link TrendAnalysis} per (layer, metricType) group.
 *
 * <h3>Per group</h3>
 * <ol>
 *   <li>Fewer than {@value #MIN_DATA_POINTS} signals → no trend (omitted, not an error).</li>
 *   <li>Sort by timestamp ascending; fit {@link LinearRegression} on (index, value).</li>
 *   <li>{@code magnitude = min(|slope|, 1)}.</li>
 *   <li>Direction: {@code CV = stdDev / |mean|} (mean 0 → 1). {@code CV > 0.3 → VOLATILE};
 *       else {@code |slope| < 0.05 → STABLE}; else sign of slope.</li>
 *   <li>Anomalies: {@code |value − mean| / stdDev > 2.0} (stdDev 0 → 1).</li>
 *   <li>{@code velocity = (last − first) / hours(first → last)}, 0 for a zero time span.</li>
 *   <li>{@code confidence = mean(signal confidence)}.</li>
 * </ol>
 *
 * <p>Every value must be numeric: a structured signal in a trend group is a caller
 * contract violation and surfaces as {@link IllegalStateException}.
 *
 * <p>Stateless and pure.
 */
public final class TrendAnalyzer {

    static final int    MIN_DATA_POINTS      = 2;
    static final double VOLATILITY_THRESHOLD = 0.3;
    static final double SLOPE_THRESHOLD      = 0.05;
    static final double ANOMALY_THRESHOLD    = 2.0;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private TrendAnalyzer() {}

    /**
     * @param signalsByLayer signals keyed by layer; iteration order drives output order
     * @return trends in layer order, then first-seen metric order within a layer
     */
    public static List<TrendAnalysis> analyzeTrends(Map<String, List<Signal>> signalsByLayer) {
        List<TrendAnalysis> trends = new ArrayList<>();
        for (Map.Entry<String, List<Signal>> layerEntry : signalsByLayer.entrySet()) {
            Map<String, List<Signal>> metricGroups = groupByMetricType(layerEntry.getValue());
            for (Map.Entry<String, List<Signal>> group : metricGroups.entrySet()) {
                calculateTrend(group.getKey(), layerEntry.getKey(), group.getValue())
                    .ifPresent(trends::add);
            }
        }
        return trends;
    }

    static Map<String, List<Signal>> groupByMetricType(List<Signal> signals) {
        Map<String, List<Signal>> groups = new LinkedHashMap<>();
        for (Signal s : signals) {
            groups.computeIfAbsent(s.metricType(), k -> new ArrayList<>()).add(s);
        }
        return groups;
    }

    static Optional<TrendAnalysis> calculateTrend(String metricType, String layer, List<Signal> signals) {
        if (signals.size() < MIN_DATA_POINTS) {
            return Optional.empty();
        }
        List<Signal> sorted = signals.stream()
            .sorted(Comparator.comparing(Signal::timestamp))
            .toList();
        double[] values = sorted.stream().mapToDouble(s -> s.value().asNumber()).toArray();

        double slope     = LinearRegression.slope(values);
        double magnitude = Math.min(Math.abs(slope), 1.0);

        double avgConfidence = signals.stream().mapToDouble(Signal::confidence).average().orElse(0.0);

        return Optional.of(new TrendAnalysis(
            metricType,
            layer,
            determineDirection(slope, values),
            magnitude,
            calculateVelocity(sorted),
            signals.size(),
            avgConfidence,
            detectAnomalies(sorted, values)));
    }

    static TrendDirection determineDirection(double slope, double[] values) {
        double stdDev = DescriptiveStatistics.stdDev(values);
        double mean   = DescriptiveStatistics.mean(values);
        double coefficientOfVariation = stdDev / Math.abs(mean == 0.0 ? 1.0 : mean);

        // volatility is checked before slope: a noisy flat series is VOLATILE, not STABLE
        if (coefficientOfVariation > VOLATILITY_THRESHOLD) {
            return TrendDirection.VOLATILE;
        }
        if (Math.abs(slope) < SLOPE_THRESHOLD) {
            return TrendDirection.STABLE;
        }
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    static List<Anomaly> detectAnomalies(List<Signal> sorted, double[] values) {
        double mean   = DescriptiveStatistics.mean(values);
        double stdDev = DescriptiveStatistics.stdDev(values);
        double denominator = stdDev == 0.0 ? 1.0 : stdDev;

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double deviationScore = Math.abs(values[i] - mean) / denominator;
            if (deviationScore > ANOMALY_THRESHOLD) {
                anomalies.add(new Anomaly(sorted.get(i).timestamp(), values[i], deviationScore));
            }
        }
        return anomalies;
    }

    static double calculateVelocity(List<Signal> sorted) {
        if (sorted.size() < MIN_DATA_POINTS) {
            return 0.0;
        }
        Signal first = sorted.get(0);
        Signal last  = sorted.get(sorted.size() - 1);
        double hours = Duration.between(first.timestamp(), last.timestamp()).toMillis() / MILLIS_PER_HOUR;
        if (hours == 0.0) {
            return 0.0;
        }
        return (last.value().asNumber() - first.value().asNumber()) / hours;
    }
}
