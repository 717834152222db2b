package com.analyticshub.common.consensus;

import com.analyticshub.common.model.SignalValue;

import java.util.List;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code consensusValue}:   aggregated value; {@code null} when no signal survived the scope filter</li>
 *   <li>{@code agreementLevel}:   mean agreement score over the filtered signals, [0.0, 1.0], 3 dp</li>
 *   <li>{@code agreementCount}:   signals whose agreement score met the threshold</li>
 *   <li>{@code totalSignals}:     filtered signal count (unfiltered count when nothing survived)</li>
 *   <li>{@code divergentSignals}: below-threshold signals, populated only when requested</li>
 *   <li>{@code statistics}:       numeric summary; {@code null} when no numeric signal was present</li>
 *   <li>{@code confidence}:       weighted mean signal confidence × agreementLevel, 3 dp</li>
 * </ul>
 */
public record ConsensusResult(
    SignalValue consensusValue,
    double agreementLevel,
    int agreementCount,
    int totalSignals,
    List<DivergentSignal> divergentSignals,
    SignalStatistics statistics,
    double confidence,
    AggregationMethod method
) {
    public ConsensusResult {
        divergentSignals = divergentSignals == null ? List.of() : List.copyOf(divergentSignals);
    }

    static ConsensusResult empty(int totalSignals, AggregationMethod method) {
        return new ConsensusResult(null, 0.0, 0, totalSignals, List.of(), null, 0.0, method);
    }

    public boolean hasConsensusValue() {
        return consensusValue != null;
    }
}
