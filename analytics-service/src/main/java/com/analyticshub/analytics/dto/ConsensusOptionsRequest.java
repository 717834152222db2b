package com.analyticshub.analytics.dto;

import com.analyticshub.common.consensus.AggregationMethod;
import com.analyticshub.common.consensus.ConfidenceWeighting;
import com.analyticshub.common.consensus.ConsensusOptions;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Consensus options as received; every field is optional and defaults on {@link #resolve}. */
public record ConsensusOptionsRequest(
    @JsonProperty("aggregationMethod")        AggregationMethod aggregationMethod,
    @JsonProperty("confidenceWeighting")      ConfidenceWeighting confidenceWeighting,
    @JsonProperty("minAgreementThreshold")    Double minAgreementThreshold,
    @JsonProperty("scopeFilter")              List<String> scopeFilter,
    @JsonProperty("includeDivergentAnalysis") Boolean includeDivergentAnalysis
) {
    /** Fills unset fields from {@link ConsensusOptions#defaults()}; a {@code null} request yields the defaults. */
    public static ConsensusOptions resolve(ConsensusOptionsRequest request) {
        ConsensusOptions defaults = ConsensusOptions.defaults();
        if (request == null) {
            return defaults;
        }
        return new ConsensusOptions(
            request.aggregationMethod() != null ? request.aggregationMethod() : defaults.aggregationMethod(),
            request.confidenceWeighting() != null ? request.confidenceWeighting() : defaults.confidenceWeighting(),
            request.minAgreementThreshold() != null ? request.minAgreementThreshold() : defaults.minAgreementThreshold(),
            request.scopeFilter(),
            request.includeDivergentAnalysis() != null ? request.includeDivergentAnalysis() : defaults.includeDivergentAnalysis());
    }
}
