package com.analyticshub.common.consensus;

import com.analyticshub.common.model.Signal;
import com.analyticshub.common.model.SignalValue;
import com.analyticshub.common.stats.DescriptiveStatistics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Default {@link ConsensusEngine}: confidence-weighted aggregation with divergence analysis.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Keep only signals whose {@code sourceLayer} is in the scope filter (if one is set).</li>
 *   <li>Split into numeric and structured signals; the two are never mixed.</li>
 *   <li>Weight each numeric signal with {@link ConfidenceWeighting#weight(double)}.</li>
 *   <li>Numeric present → {@link AggregationMethod#aggregate}; statistics always computed.
 *       Otherwise the highest-confidence structured value wins (earliest on ties).</li>
 *   <li>Score every filtered signal against the consensus:
 *       {@code agreement = 1 − divergence}; agrees iff {@code agreement ≥ minAgreementThreshold}.</li>
 *   <li>{@code agreementLevel = mean(agreement)}, rounded to 3 dp.</li>
 *   <li>{@code confidence = (Σ confidence·weight / Σ weight) × agreementLevel}, rounded to 3 dp.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe. It does NOT modify {@link Signal} instances.
 */
public class ConfidenceWeightedConsensusStrategy implements ConsensusEngine {

    @Override
    public ConsensusResult computeConsensus(List<Signal> signals, ConsensusOptions options) {
        List<Signal> filtered = options.hasScopeFilter()
            ? signals.stream().filter(s -> options.scopeFilter().contains(s.sourceLayer())).toList()
            : signals;

        if (filtered.isEmpty()) {
            return ConsensusResult.empty(signals.size(), options.aggregationMethod());
        }

        List<Signal> numericSignals    = new ArrayList<>();
        List<Signal> structuredSignals = new ArrayList<>();
        for (Signal s : filtered) {
            if (s.value().isNumeric()) numericSignals.add(s);
            else                       structuredSignals.add(s);
        }

        ConfidenceWeighting weighting = options.confidenceWeighting();
        SignalValue consensusValue;
        SignalStatistics statistics = null;

        if (!numericSignals.isEmpty()) {
            double[] values  = new double[numericSignals.size()];
            double[] weights = new double[numericSignals.size()];
            for (int i = 0; i < values.length; i++) {
                Signal s = numericSignals.get(i);
                values[i]  = s.value().asNumber();
                weights[i] = weighting.weight(s.confidence());
            }
            consensusValue = SignalValue.numeric(options.aggregationMethod().aggregate(values, weights));
            statistics = SignalStatistics.of(values);
        } else {
            // stable sort keeps the earliest signal first among equal confidences
            consensusValue = structuredSignals.stream()
                .sorted(Comparator.comparingDouble(Signal::confidence).reversed())
                .findFirst()
                .map(Signal::value)
                .orElse(null);
        }

        Agreement agreement = calculateAgreement(filtered, consensusValue,
            options.minAgreementThreshold(), options.includeDivergentAnalysis());

        double weightedConfidenceSum = 0.0;
        double totalWeight = 0.0;
        for (Signal s : filtered) {
            double w = weighting.weight(s.confidence());
            weightedConfidenceSum += s.confidence() * w;
            totalWeight += w;
        }
        double avgWeightedConfidence = totalWeight > 0.0 ? weightedConfidenceSum / totalWeight : 0.0;
        double confidence = avgWeightedConfidence * agreement.level();

        return new ConsensusResult(
            consensusValue,
            agreement.level(),
            agreement.count(),
            filtered.size(),
            agreement.divergent(),
            statistics,
            DescriptiveStatistics.round3(confidence),
            options.aggregationMethod());
    }

    static Agreement calculateAgreement(List<Signal> signals, SignalValue consensusValue,
                                        double threshold, boolean includeDivergent) {
        if (signals.isEmpty() || consensusValue == null) {
            return new Agreement(0.0, 0, List.of());
        }
        List<DivergentSignal> divergent = new ArrayList<>();
        double agreementSum = 0.0;
        int agreementCount = 0;

        for (Signal signal : signals) {
            double divergenceScore = DivergenceCalculator.divergence(signal.value(), consensusValue);
            double agreementScore  = 1.0 - divergenceScore;
            agreementSum += agreementScore;

            if (agreementScore >= threshold) {
                agreementCount++;
            } else if (includeDivergent) {
                divergent.add(new DivergentSignal(signal.signalId(),
                    DescriptiveStatistics.round3(divergenceScore), signal.value()));
            }
        }
        double level = DescriptiveStatistics.round3(agreementSum / signals.size());
        return new Agreement(level, agreementCount, divergent);
    }

    record Agreement(double level, int count, List<DivergentSignal> divergent) {}
}
