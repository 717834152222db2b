package com.analyticshub.common.consensus;

import com.analyticshub.common.model.SignalValue;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The {@code outputs} section of a consensus decision record.
 *
 * <p>{@code divergentSignals} and {@code statistics} are left out of the JSON when there
 * is nothing to report; {@code consensusValue} is always written, as {@code null} when absent.
 */
public record ConsensusOutput(
    @JsonProperty("consensusValue") @JsonInclude(JsonInclude.Include.ALWAYS)
    SignalValue consensusValue,
    @JsonProperty("agreementLevel") double agreementLevel,
    @JsonProperty("agreementCount") int agreementCount,
    @JsonProperty("totalSignals")   int totalSignals,
    @JsonProperty("divergentSignals") @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<DivergentSignal> divergentSignals,
    @JsonProperty("statistics") @JsonInclude(JsonInclude.Include.NON_NULL)
    SignalStatistics statistics
) {
    public static ConsensusOutput from(ConsensusResult result) {
        return new ConsensusOutput(
            result.consensusValue(),
            result.agreementLevel(),
            result.agreementCount(),
            result.totalSignals(),
            result.divergentSignals(),
            result.statistics());
    }
}
