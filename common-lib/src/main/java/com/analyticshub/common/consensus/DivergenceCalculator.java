package com.analyticshub.common.consensus;

import com.analyticshub.common.exception.AnalyticsException;
import com.analyticshub.common.exception.ErrorCode;
import com.analyticshub.common.json.JsonSupport;
import com.analyticshub.common.model.SignalValue;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Normalized distance between a signal value and the consensus value, in [0.0, 1.0].
 *
 * <pre>
 *   numeric    vs numeric    → min(|s − c| / |c|, 1)   (c = 0 → 0 iff s = 0, else 1)
 *   structured vs structured → 0 if serialized JSON is identical, else 1
 *   mismatched variants      → 1
 * </pre>
 *
 * <p>Structured comparison is order-sensitive: two objects with the same entries in a
 * different key order are divergent.
 */
public final class DivergenceCalculator {

    static final double MAX_DIVERGENCE = 1.0;

    private DivergenceCalculator() {}

    public static double divergence(SignalValue signalValue, SignalValue consensusValue) {
        if (signalValue instanceof SignalValue.Numeric s && consensusValue instanceof SignalValue.Numeric c) {
            if (c.value() == 0.0) {
                return s.value() == 0.0 ? 0.0 : MAX_DIVERGENCE;
            }
            double relativeDiff = Math.abs(s.value() - c.value()) / Math.abs(c.value());
            return Math.min(relativeDiff, MAX_DIVERGENCE);
        }
        if (signalValue instanceof SignalValue.Structured s && consensusValue instanceof SignalValue.Structured c) {
            return serialize(s).equals(serialize(c)) ? 0.0 : MAX_DIVERGENCE;
        }
        return MAX_DIVERGENCE;
    }

    private static String serialize(SignalValue.Structured value) {
        try {
            return JsonSupport.mapper().writeValueAsString(value.fields());
        } catch (JsonProcessingException e) {
            throw new AnalyticsException("consensus-agent", ErrorCode.CONSENSUS_COMPUTATION_ERROR,
                "Structured signal value is not serializable", e);
        }
    }
}
