package com.analyticshub.common.consensus;

import com.analyticshub.common.model.Signal;

import java.util.List;

/**
 * Strategy contract for deriving one consensus value from a flat signal list.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>:      no I/O, no clock reads; identical inputs give identical results</li>
 *   <li><b>Total</b>:     an empty (or fully filtered-out) signal list yields a zero
 *       result, never an exception</li>
 * </ul>
 *
 * <p>Current implementation: {@link ConfidenceWeightedConsensusStrategy}.
 */
public interface ConsensusEngine {

    /**
     * @param signals immutable snapshot of the signals to reconcile
     * @param options aggregation configuration, already defaulted by the caller
     * @return a {@link ConsensusResult}: never {@code null}
     */
    ConsensusResult computeConsensus(List<Signal> signals, ConsensusOptions options);
}
