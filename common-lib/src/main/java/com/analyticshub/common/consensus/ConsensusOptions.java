package com.analyticshub.common.consensus;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Configuration of a single consensus computation. Not persisted.
 *
 * <p>An empty {@code scopeFilter} means "all layers".
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ConsensusOptions(
    @JsonProperty("aggregationMethod")        AggregationMethod aggregationMethod,
    @JsonProperty("confidenceWeighting")      ConfidenceWeighting confidenceWeighting,
    @JsonProperty("minAgreementThreshold")    double minAgreementThreshold,
    @JsonProperty("scopeFilter")              List<String> scopeFilter,
    @JsonProperty("includeDivergentAnalysis") boolean includeDivergentAnalysis
) {
    public static final double DEFAULT_MIN_AGREEMENT_THRESHOLD = 0.6;

    public ConsensusOptions {
        scopeFilter = scopeFilter == null ? List.of() : List.copyOf(scopeFilter);
    }

    /** weighted_mean, proportional weighting, threshold 0.6, divergent analysis on, no scope filter. */
    public static ConsensusOptions defaults() {
        return new ConsensusOptions(AggregationMethod.WEIGHTED_MEAN, ConfidenceWeighting.PROPORTIONAL,
                                    DEFAULT_MIN_AGREEMENT_THRESHOLD, List.of(), true);
    }

    public boolean hasScopeFilter() {
        return !scopeFilter.isEmpty();
    }
}
